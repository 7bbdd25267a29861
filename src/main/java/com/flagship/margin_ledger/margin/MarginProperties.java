package com.flagship.margin_ledger.margin;

import com.flagship.margin_ledger.common.CurrencyCode;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Margin configuration (margin.*). Levels are percentages of used margin.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "margin")
public class MarginProperties {

    @NotNull
    private CurrencyCode settlementCurrency = CurrencyCode.USDT;

    @Min(1)
    private int maxLeverageCap = 50;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private BigDecimal maintenanceMarginRatio = new BigDecimal("0.10");

    @DecimalMin("0.0")
    private BigDecimal marginCallLevel = new BigDecimal("50");

    @DecimalMin("0.0")
    private BigDecimal liquidationLevel = new BigDecimal("10");

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private BigDecimal penaltyFeeRate = new BigDecimal("0.03");

    @Min(1)
    private int defaultMaxLeverage = 10;

    @DecimalMin("0.0")
    private BigDecimal defaultMaxPositionNotional = new BigDecimal("100000");

    @Min(1)
    private int defaultMaxOpenPositions = 5;

    /**
     * Fallback mark prices by symbol, e.g. {@code BTC/USDT: 45000}.
     */
    private Map<String, BigDecimal> prices = new LinkedHashMap<>();

    private Monitor monitor = new Monitor();

    @Data
    public static class Monitor {
        private boolean enabled = false;
        private long intervalMs = 10000;
    }
}

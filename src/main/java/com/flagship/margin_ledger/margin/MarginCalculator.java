package com.flagship.margin_ledger.margin;

import com.flagship.margin_ledger.common.CurrencyCode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Margin arithmetic. Sizes are in base-asset units and prices in the settlement
 * currency; P&L carries no leverage factor.
 *
 * - notional = size * price
 * - initialMargin = notional / leverage, rounded up to minor units
 * - maintenanceMargin = initialMargin * maintenanceMarginRatio
 * - liquidationPrice = entry -/+ (initialMargin - maintenanceMargin) / size (long / short)
 * - pnl = (price - entry) * size for long, (entry - price) * size for short
 */
@Component
@RequiredArgsConstructor
public class MarginCalculator {

    static final int PRICE_SCALE = 8;
    static final int LEVEL_SCALE = 4;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final MarginProperties properties;

    public BigDecimal notional(BigDecimal size, BigDecimal price) {
        return size.multiply(price);
    }

    public BigDecimal initialMargin(BigDecimal notional, int leverage, CurrencyCode currency) {
        return notional.divide(BigDecimal.valueOf(leverage), currency.minorUnits(), RoundingMode.UP);
    }

    public BigDecimal maintenanceMargin(BigDecimal initialMargin, CurrencyCode currency) {
        return initialMargin.multiply(properties.getMaintenanceMarginRatio())
            .setScale(currency.minorUnits(), RoundingMode.HALF_UP);
    }

    /**
     * Mark price at which the position's loss leaves exactly its maintenance margin.
     */
    public BigDecimal liquidationPrice(PositionSide side, BigDecimal entryPrice, BigDecimal size,
                                       BigDecimal initialMargin, BigDecimal maintenanceMargin) {
        BigDecimal buffer = initialMargin.subtract(maintenanceMargin)
            .divide(size, PRICE_SCALE, RoundingMode.HALF_EVEN);
        BigDecimal price = side == PositionSide.LONG ? entryPrice.subtract(buffer) : entryPrice.add(buffer);
        return price.max(BigDecimal.ZERO).setScale(PRICE_SCALE, RoundingMode.HALF_EVEN);
    }

    public BigDecimal pnl(PositionSide side, BigDecimal entryPrice, BigDecimal price, BigDecimal size,
                          CurrencyCode currency) {
        return currency.round(price.subtract(entryPrice).multiply(size).multiply(side.sign()));
    }

    /**
     * totalEquity / usedMargin * 100, or 0 when nothing is used.
     */
    public BigDecimal marginLevel(BigDecimal totalEquity, BigDecimal usedMargin) {
        if (usedMargin.signum() == 0) {
            return BigDecimal.ZERO.setScale(LEVEL_SCALE);
        }
        return totalEquity.multiply(HUNDRED).divide(usedMargin, LEVEL_SCALE, RoundingMode.HALF_EVEN);
    }

    public MarginAccountStatus statusFor(BigDecimal usedMargin, BigDecimal marginLevel) {
        if (usedMargin.signum() == 0) {
            return MarginAccountStatus.ACTIVE;
        }
        if (marginLevel.compareTo(properties.getLiquidationLevel()) <= 0) {
            return MarginAccountStatus.LIQUIDATION;
        }
        if (marginLevel.compareTo(properties.getMarginCallLevel()) < 0) {
            return MarginAccountStatus.MARGIN_CALL;
        }
        return MarginAccountStatus.ACTIVE;
    }

    /**
     * Leverage allowed for an account: its own maximum, capped globally, reduced for
     * risk scores above 50 down to a floor of 1.
     */
    public int effectiveMaxLeverage(int accountMaxLeverage, int riskScore) {
        int max = Math.min(accountMaxLeverage, properties.getMaxLeverageCap());
        if (riskScore <= 50) {
            return max;
        }
        return Math.max(1, max * (100 - riskScore) / 50);
    }

    public BigDecimal penaltyFee(BigDecimal liquidationValue, CurrencyCode currency) {
        return currency.round(liquidationValue.multiply(properties.getPenaltyFeeRate()));
    }
}

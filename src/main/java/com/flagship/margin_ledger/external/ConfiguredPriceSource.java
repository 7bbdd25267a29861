package com.flagship.margin_ledger.external;

import com.flagship.margin_ledger.common.ValidationException;
import com.flagship.margin_ledger.margin.MarginProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Price table seeded from {@code margin.prices} and updated by {@link #updatePrice}.
 */
@Component
@Slf4j
public class ConfiguredPriceSource implements PriceSource {

    private final Map<String, BigDecimal> prices = new ConcurrentHashMap<>();

    @Autowired
    public ConfiguredPriceSource(MarginProperties properties) {
        this(properties.getPrices());
    }

    public ConfiguredPriceSource(Map<String, BigDecimal> initialPrices) {
        initialPrices.forEach(this::updatePrice);
        log.info("Price table seeded with {} symbols", prices.size());
    }

    @Override
    public BigDecimal getCurrentPrice(String symbol) {
        BigDecimal price = symbol == null ? null : prices.get(symbol);
        if (price == null) {
            throw new PriceUnavailableException(symbol);
        }
        return price;
    }

    public void updatePrice(String symbol, BigDecimal price) {
        ValidationException.requireText(symbol, "symbol");
        ValidationException.requireNonNull(price, "price");
        if (price.signum() <= 0) {
            throw new ValidationException("Price must be positive for " + symbol);
        }
        prices.put(symbol, price);
    }

    public Map<String, BigDecimal> snapshot() {
        return Map.copyOf(prices);
    }
}

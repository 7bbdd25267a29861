package com.flagship.margin_ledger.external;

import com.flagship.margin_ledger.common.ValidationException;
import com.flagship.margin_ledger.margin.MarginProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfiguredPriceSourceTest {

    @Test
    @DisplayName("Prices are seeded from configuration and can be updated")
    void seededAndUpdated() {
        MarginProperties properties = new MarginProperties();
        properties.getPrices().put("BTC/USDT", new BigDecimal("45000"));
        ConfiguredPriceSource source = new ConfiguredPriceSource(properties);

        assertEquals(0, source.getCurrentPrice("BTC/USDT").compareTo(new BigDecimal("45000")));

        source.updatePrice("BTC/USDT", new BigDecimal("46000"));
        assertEquals(Map.of("BTC/USDT", new BigDecimal("46000")), source.snapshot());
    }

    @Test
    @DisplayName("Unknown symbols are unavailable; non-positive prices are rejected")
    void unknownAndInvalid() {
        ConfiguredPriceSource source = new ConfiguredPriceSource(Map.of());

        PriceUnavailableException e = assertThrows(PriceUnavailableException.class,
            () -> source.getCurrentPrice("XRP/USDT"));
        assertEquals("RETRYABLE", e.getCode());
        assertThrows(ValidationException.class, () -> source.updatePrice("XRP/USDT", BigDecimal.ZERO));
    }
}

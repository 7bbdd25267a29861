package com.flagship.margin_ledger.external;

import java.math.BigDecimal;

/**
 * Mark prices for margin valuation, quoted in the settlement currency.
 */
public interface PriceSource {

    /**
     * @throws PriceUnavailableException no price is known for the symbol
     */
    BigDecimal getCurrentPrice(String symbol);
}

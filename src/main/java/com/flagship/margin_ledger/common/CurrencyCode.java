package com.flagship.margin_ledger.common;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Currencies the ledger accepts, each with its number of minor units.
 *
 * Amounts are validated against the minor units so that every sum the ledger
 * compares is exact.
 */
public enum CurrencyCode {
    USD(2),
    EUR(2),
    GBP(2),
    INR(2),
    JPY(0),
    USDT(6),
    USDC(6),
    BTC(8),
    ETH(8);

    private final int minorUnits;

    CurrencyCode(int minorUnits) {
        this.minorUnits = minorUnits;
    }

    public int minorUnits() {
        return minorUnits;
    }

    /**
     * True if the amount can be represented exactly in this currency's minor units.
     */
    public boolean fits(BigDecimal amount) {
        return amount.stripTrailingZeros().scale() <= minorUnits;
    }

    /**
     * Amount at this currency's scale; fails if rounding would be needed.
     */
    public BigDecimal normalize(BigDecimal amount) {
        return amount.setScale(minorUnits, RoundingMode.UNNECESSARY);
    }

    /**
     * Half-even rounding, for P&L and other computed values.
     */
    public BigDecimal round(BigDecimal amount) {
        return amount.setScale(minorUnits, RoundingMode.HALF_EVEN);
    }

    /**
     * Rounds away from zero, for reservations that must never fall short.
     */
    public BigDecimal roundUp(BigDecimal amount) {
        return amount.setScale(minorUnits, RoundingMode.UP);
    }

    public BigDecimal zero() {
        return BigDecimal.ZERO.setScale(minorUnits);
    }

    public static CurrencyCode parse(String code) {
        ValidationException.requireText(code, "currency");
        try {
            return CurrencyCode.valueOf(code.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unsupported currency code: " + code);
        }
    }
}

package com.flagship.margin_ledger.margin;

import java.math.BigDecimal;

public enum PositionSide {
    LONG(BigDecimal.ONE),
    SHORT(BigDecimal.ONE.negate());

    private final BigDecimal sign;

    PositionSide(BigDecimal sign) {
        this.sign = sign;
    }

    /**
     * +1 for LONG, -1 for SHORT: a long gains when the price rises.
     */
    public BigDecimal sign() {
        return sign;
    }
}

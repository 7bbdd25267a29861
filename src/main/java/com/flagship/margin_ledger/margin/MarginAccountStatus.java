package com.flagship.margin_ledger.margin;

/**
 * Margin account status.
 *
 * ACTIVE, MARGIN_CALL and LIQUIDATION follow from the margin level after every
 * recomputation. SUSPENDED and CLOSED are set administratively and are never
 * overwritten by a recomputation.
 */
public enum MarginAccountStatus {
    ACTIVE,
    MARGIN_CALL,
    LIQUIDATION,
    SUSPENDED,
    CLOSED;

    public boolean isAdministrative() {
        return this == SUSPENDED || this == CLOSED;
    }
}

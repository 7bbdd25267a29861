package com.flagship.margin_ledger.margin;

/**
 * OPEN -> CLOSING -> CLOSED | LIQUIDATED. CLOSING falls back to OPEN when the close fails
 * before any money moved.
 */
public enum PositionStatus {
    OPEN,
    CLOSING,
    CLOSED,
    LIQUIDATED;

    public boolean isTerminal() {
        return this == CLOSED || this == LIQUIDATED;
    }
}

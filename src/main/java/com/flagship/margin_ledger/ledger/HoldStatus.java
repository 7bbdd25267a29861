package com.flagship.margin_ledger.ledger;

/**
 * Hold lifecycle: ACTIVE -> RELEASED or ACTIVE -> EXPIRED.
 * RELEASED and EXPIRED are terminal.
 */
public enum HoldStatus {
    ACTIVE,
    RELEASED,
    EXPIRED
}

package com.flagship.margin_ledger.margin;

/**
 * ISOLATED accounts trade a single symbol; CROSS accounts share margin across symbols.
 */
public enum MarginAccountType {
    ISOLATED,
    CROSS
}

package com.flagship.margin_ledger.common;

/**
 * Caller-visible failure kinds.
 *
 * The API layer maps each kind to one response class, so a caller can tell
 * bad input, funds conflicts, missing entities and retryable outages apart
 * without parsing messages.
 */
public enum ErrorKind {
    VALIDATION,
    UNBALANCED_ENTRY,
    INVALID_LEVERAGE,
    INSUFFICIENT_AVAILABLE_BALANCE,
    INSUFFICIENT_MARGIN,
    RISK_LIMIT_EXCEEDED,
    ALREADY_EXISTS,
    POSITION_ALREADY_CLOSED,
    NOT_FOUND,
    RETRYABLE
}

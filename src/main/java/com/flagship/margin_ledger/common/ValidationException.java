package com.flagship.margin_ledger.common;

/**
 * Malformed or missing input: empty required field, bad enum value, amount with too many
 * decimals, operation on a closed account.
 */
public class ValidationException extends DomainException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
    }

    public static void requireNonNull(Object value, String field) {
        if (value == null) {
            throw new ValidationException(field + " is required");
        }
    }
}

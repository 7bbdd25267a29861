package com.flagship.margin_ledger.common;

/**
 * A critical section could not be entered within the configured wait.
 * Nothing was changed; the caller may retry.
 */
public class LockAcquisitionException extends DomainException {

    public LockAcquisitionException(String message) {
        super(ErrorKind.RETRYABLE, message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(ErrorKind.RETRYABLE, message, cause);
    }
}

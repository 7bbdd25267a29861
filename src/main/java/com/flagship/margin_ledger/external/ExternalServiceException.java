package com.flagship.margin_ledger.external;

import com.flagship.margin_ledger.common.DomainException;
import com.flagship.margin_ledger.common.ErrorKind;

/**
 * The external ledger failed or could not be reached. Retryable.
 */
public class ExternalServiceException extends DomainException {

    public ExternalServiceException(String message) {
        super(ErrorKind.RETRYABLE, message);
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(ErrorKind.RETRYABLE, message, cause);
    }
}

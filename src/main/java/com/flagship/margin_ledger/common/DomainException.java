package com.flagship.margin_ledger.common;

import lombok.Getter;

/**
 * Base type for every typed failure raised by the ledger and margin components.
 * Subclasses fix the {@link ErrorKind}; callers switch on the kind or catch the subclass.
 */
@Getter
public abstract class DomainException extends RuntimeException {

    private final ErrorKind kind;

    protected DomainException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected DomainException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Short machine-readable code for API responses, e.g. {@code INSUFFICIENT_MARGIN}.
     */
    public String getCode() {
        return kind.name();
    }
}

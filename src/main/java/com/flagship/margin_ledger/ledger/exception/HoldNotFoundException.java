package com.flagship.margin_ledger.ledger.exception;

import com.flagship.margin_ledger.common.DomainException;
import com.flagship.margin_ledger.common.ErrorKind;

import java.util.UUID;

/**
 * The hold does not exist or is no longer ACTIVE (released or expired).
 */
public class HoldNotFoundException extends DomainException {

    public HoldNotFoundException(UUID holdId) {
        super(ErrorKind.NOT_FOUND, "Hold not found or no longer active: " + holdId);
    }
}

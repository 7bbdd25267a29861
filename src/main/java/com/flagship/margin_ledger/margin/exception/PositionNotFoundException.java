package com.flagship.margin_ledger.margin.exception;

import com.flagship.margin_ledger.common.DomainException;
import com.flagship.margin_ledger.common.ErrorKind;

import java.util.UUID;

public class PositionNotFoundException extends DomainException {

    public PositionNotFoundException(UUID positionId) {
        super(ErrorKind.NOT_FOUND, "Position not found: " + positionId);
    }
}

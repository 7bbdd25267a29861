package com.flagship.margin_ledger.margin.exception;

import com.flagship.margin_ledger.common.DomainException;
import com.flagship.margin_ledger.common.ErrorKind;
import com.flagship.margin_ledger.margin.PositionStatus;

import java.util.UUID;

/**
 * The position is not OPEN: closed, liquidated, or being closed by another caller.
 */
public class PositionAlreadyClosedException extends DomainException {

    public PositionAlreadyClosedException(UUID positionId, PositionStatus status) {
        super(ErrorKind.POSITION_ALREADY_CLOSED, "Position " + positionId + " is " + status);
    }
}

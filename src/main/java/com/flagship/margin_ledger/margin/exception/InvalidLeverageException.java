package com.flagship.margin_ledger.margin.exception;

import com.flagship.margin_ledger.common.DomainException;
import com.flagship.margin_ledger.common.ErrorKind;

public class InvalidLeverageException extends DomainException {

    public InvalidLeverageException(int leverage, int maxLeverage) {
        super(ErrorKind.INVALID_LEVERAGE,
            String.format("Invalid leverage %d. Must be between 1 and %d", leverage, maxLeverage));
    }
}

package com.flagship.margin_ledger.margin.exception;

import com.flagship.margin_ledger.common.DomainException;
import com.flagship.margin_ledger.common.ErrorKind;

public class RiskLimitExceededException extends DomainException {

    public RiskLimitExceededException(String message) {
        super(ErrorKind.RISK_LIMIT_EXCEEDED, message);
    }
}

package com.flagship.margin_ledger.margin.exception;

import com.flagship.margin_ledger.common.DomainException;
import com.flagship.margin_ledger.common.ErrorKind;

public class MarginAccountNotFoundException extends DomainException {

    public MarginAccountNotFoundException(String accountId) {
        super(ErrorKind.NOT_FOUND, "Margin account not found: " + accountId);
    }
}

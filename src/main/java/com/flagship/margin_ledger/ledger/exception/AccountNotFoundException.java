package com.flagship.margin_ledger.ledger.exception;

import com.flagship.margin_ledger.common.DomainException;
import com.flagship.margin_ledger.common.ErrorKind;

public class AccountNotFoundException extends DomainException {

    public AccountNotFoundException(String accountId) {
        super(ErrorKind.NOT_FOUND, "Account not found: " + accountId);
    }
}

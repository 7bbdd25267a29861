package com.flagship.margin_ledger.ledger.exception;

import com.flagship.margin_ledger.common.DomainException;
import com.flagship.margin_ledger.common.ErrorKind;
import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class InsufficientAvailableBalanceException extends DomainException {

    private final String accountId;
    private final BigDecimal available;
    private final BigDecimal requested;

    public InsufficientAvailableBalanceException(String accountId, BigDecimal available, BigDecimal requested) {
        super(ErrorKind.INSUFFICIENT_AVAILABLE_BALANCE, String.format(
            "Insufficient available balance on account %s: available=%s, requested=%s",
            accountId, available.toPlainString(), requested.toPlainString()));
        this.accountId = accountId;
        this.available = available;
        this.requested = requested;
    }
}

package com.flagship.margin_ledger.margin.exception;

import com.flagship.margin_ledger.common.DomainException;
import com.flagship.margin_ledger.common.ErrorKind;
import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class InsufficientMarginException extends DomainException {

    private final BigDecimal required;
    private final BigDecimal available;

    public InsufficientMarginException(BigDecimal required, BigDecimal available) {
        super(ErrorKind.INSUFFICIENT_MARGIN, String.format(
            "Insufficient margin: required=%s, available=%s", required.toPlainString(), available.toPlainString()));
        this.required = required;
        this.available = available;
    }
}

package com.flagship.margin_ledger.ledger.exception;

import com.flagship.margin_ledger.common.CurrencyCode;
import com.flagship.margin_ledger.common.DomainException;
import com.flagship.margin_ledger.common.ErrorKind;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Debits and credits of a journal entry differ for one currency.
 */
@Getter
public class UnbalancedEntryException extends DomainException {

    private final CurrencyCode currency;
    private final BigDecimal debitTotal;
    private final BigDecimal creditTotal;

    public UnbalancedEntryException(CurrencyCode currency, BigDecimal debitTotal, BigDecimal creditTotal) {
        super(ErrorKind.UNBALANCED_ENTRY, String.format(
            "Journal entry is not balanced for %s: debits=%s, credits=%s",
            currency, debitTotal.toPlainString(), creditTotal.toPlainString()));
        this.currency = currency;
        this.debitTotal = debitTotal;
        this.creditTotal = creditTotal;
    }
}

package com.flagship.margin_ledger.external;

import com.flagship.margin_ledger.common.DomainException;
import com.flagship.margin_ledger.common.ErrorKind;

public class PriceUnavailableException extends DomainException {

    public PriceUnavailableException(String symbol) {
        super(ErrorKind.RETRYABLE, "No price available for " + symbol);
    }
}

package com.flagship.margin_ledger.reconciliation;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One account whose internal and external balances disagree beyond tolerance,
 * or whose external balance could not be read.
 */
@Value
public class Discrepancy {

    public enum Type {
        BALANCE_MISMATCH,
        UNAVAILABLE
    }

    String accountId;
    String currency;
    BigDecimal expected;
    BigDecimal actual;
    BigDecimal difference;
    Type type;
    String message;
}

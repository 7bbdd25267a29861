package com.flagship.margin_ledger.ledger;

import com.flagship.margin_ledger.common.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One side of a journal entry: a debit or a credit against one account.
 *
 * A debit takes the amount out of the account and a credit pays it in.
 * Exactly one of {@code debit} / {@code credit} is positive; the other is zero.
 */
@Value
public class JournalLine {
    String accountId;
    BigDecimal debit;
    BigDecimal credit;
    CurrencyCode currency;
    String description;

    public static JournalLine debit(String accountId, BigDecimal amount, CurrencyCode currency, String description) {
        return new JournalLine(accountId, amount, BigDecimal.ZERO, currency, description);
    }

    public static JournalLine credit(String accountId, BigDecimal amount, CurrencyCode currency, String description) {
        return new JournalLine(accountId, BigDecimal.ZERO, amount, currency, description);
    }

    public boolean isDebit() {
        return debit != null && debit.signum() > 0;
    }

    public boolean isCredit() {
        return credit != null && credit.signum() > 0;
    }

    /**
     * Effect of this line on the account balance: +credit or -debit.
     */
    public BigDecimal balanceEffect() {
        return isCredit() ? credit : debit.negate();
    }

    /**
     * The positive amount of this line, whichever side it is on.
     */
    public BigDecimal amount() {
        return isCredit() ? credit : debit;
    }
}

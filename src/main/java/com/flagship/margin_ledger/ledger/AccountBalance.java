package com.flagship.margin_ledger.ledger;

import com.flagship.margin_ledger.common.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Read-only balance snapshot of a ledger account.
 */
@Value
public class AccountBalance {
    String accountId;
    CurrencyCode currency;
    BigDecimal balance;
    BigDecimal availableBalance;

    public static AccountBalance of(Account account) {
        return new AccountBalance(account.getId(), account.getCurrency(),
            account.getBalance(), account.getAvailableBalance());
    }
}

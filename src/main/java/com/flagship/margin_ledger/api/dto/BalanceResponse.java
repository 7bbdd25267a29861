package com.flagship.margin_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.margin_ledger.ledger.AccountBalance;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class BalanceResponse {

    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("available_balance")
    BigDecimal availableBalance;

    public static BalanceResponse from(AccountBalance balance) {
        return new BalanceResponse(balance.getAccountId(), balance.getCurrency().name(),
                balance.getBalance(), balance.getAvailableBalance());
    }
}

package com.flagship.margin_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.margin_ledger.ledger.Account;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("tenant_id")
    String tenantId;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("available_balance")
    BigDecimal availableBalance;

    @JsonProperty("overdraft_allowed")
    boolean overdraftAllowed;

    @JsonProperty("status")
    Account.Status status;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
                .id(account.getId())
                .tenantId(account.getTenantId())
                .currency(account.getCurrency().name())
                .balance(account.getBalance())
                .availableBalance(account.getAvailableBalance())
                .overdraftAllowed(account.isOverdraftAllowed())
                .status(account.getStatus())
                .createdAt(account.getCreatedAt())
                .updatedAt(account.getUpdatedAt())
                .build();
    }
}

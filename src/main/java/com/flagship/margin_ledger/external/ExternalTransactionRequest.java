package com.flagship.margin_ledger.external;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /v1/ledger/entries} on the external ledger.
 *
 * Each entry carries the signed effect on the account balance: positive for a credit,
 * negative for a debit, matching how this ledger reports balances.
 */
@Value
@Builder
public class ExternalTransactionRequest {

    @JsonProperty("tenant_id")
    String tenantId;
    String reference;
    String description;
    @Singular
    List<Entry> entries;
    Map<String, String> metadata;

    @Value
    public static class Entry {
        @JsonProperty("account_id")
        String accountId;
        BigDecimal amount;
        String currency;
        String description;
        String reference;
    }
}

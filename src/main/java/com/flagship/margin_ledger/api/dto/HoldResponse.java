package com.flagship.margin_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.margin_ledger.ledger.Hold;
import com.flagship.margin_ledger.ledger.HoldStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class HoldResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("tenant_id")
    String tenantId;

    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("description")
    String description;

    @JsonProperty("status")
    HoldStatus status;

    @JsonProperty("expires_at")
    Instant expiresAt;

    @JsonProperty("metadata")
    Map<String, String> metadata;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("released_at")
    Instant releasedAt;

    public static HoldResponse from(Hold hold) {
        return HoldResponse.builder()
                .id(hold.getId())
                .tenantId(hold.getTenantId())
                .accountId(hold.getAccountId())
                .amount(hold.getAmount())
                .currency(hold.getCurrency().name())
                .description(hold.getDescription())
                .status(hold.getStatus())
                .expiresAt(hold.getExpiresAt())
                .metadata(hold.getMetadata())
                .createdAt(hold.getCreatedAt())
                .releasedAt(hold.getReleasedAt())
                .build();
    }
}

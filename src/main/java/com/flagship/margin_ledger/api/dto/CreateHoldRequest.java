package com.flagship.margin_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

@Value
public class CreateHoldRequest {

    @NotBlank(message = "Account ID is required")
    @JsonProperty("account_id")
    String accountId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Currency is required")
    @JsonProperty("currency")
    String currency;

    @NotBlank(message = "Description is required")
    @JsonProperty("description")
    String description;

    @JsonProperty("expires_at")
    Instant expiresAt;

    @JsonProperty("metadata")
    Map<String, String> metadata;
}

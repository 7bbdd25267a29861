package com.flagship.margin_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.margin_ledger.margin.MarginAccountType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class CreateMarginAccountRequest {

    @NotBlank(message = "User ID is required")
    @JsonProperty("user_id")
    String userId;

    @NotBlank(message = "Tenant ID is required")
    @JsonProperty("tenant_id")
    String tenantId;

    @NotBlank(message = "Broker ID is required")
    @JsonProperty("broker_id")
    String brokerId;

    @NotNull(message = "Account type is required")
    @JsonProperty("account_type")
    MarginAccountType accountType;

    @JsonProperty("symbol")
    String symbol;

    @NotNull(message = "Initial deposit is required")
    @DecimalMin(value = "0", message = "Initial deposit must not be negative")
    @JsonProperty("initial_deposit")
    BigDecimal initialDeposit;
}

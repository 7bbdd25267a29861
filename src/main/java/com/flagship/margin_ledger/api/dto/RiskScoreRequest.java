package com.flagship.margin_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class RiskScoreRequest {

    @NotBlank(message = "User ID is required")
    @JsonProperty("user_id")
    String userId;

    @NotBlank(message = "Tenant ID is required")
    @JsonProperty("tenant_id")
    String tenantId;

    @NotBlank(message = "Broker ID is required")
    @JsonProperty("broker_id")
    String brokerId;

    @Min(value = 0, message = "Risk score must be between 0 and 100")
    @Max(value = 100, message = "Risk score must be between 0 and 100")
    @JsonProperty("risk_score")
    int riskScore;
}

package com.flagship.margin_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * Identifies the (user, tenant, broker) triple acting on a position.
 */
@Value
public class OwnerRequest {

    @NotBlank(message = "User ID is required")
    @JsonProperty("user_id")
    String userId;

    @NotBlank(message = "Tenant ID is required")
    @JsonProperty("tenant_id")
    String tenantId;

    @NotBlank(message = "Broker ID is required")
    @JsonProperty("broker_id")
    String brokerId;
}

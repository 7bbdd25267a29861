package com.flagship.margin_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.margin_ledger.margin.RiskLimits;
import com.flagship.margin_ledger.margin.RiskTier;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
public class RiskLimitsResponse {

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("tenant_id")
    String tenantId;

    @JsonProperty("broker_id")
    String brokerId;

    @JsonProperty("max_leverage")
    int maxLeverage;

    @JsonProperty("max_position_notional")
    BigDecimal maxPositionNotional;

    @JsonProperty("max_open_positions")
    int maxOpenPositions;

    @JsonProperty("risk_score")
    int riskScore;

    @JsonProperty("risk_tier")
    RiskTier riskTier;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static RiskLimitsResponse from(RiskLimits limits) {
        return new RiskLimitsResponse(limits.getUserId(), limits.getTenantId(), limits.getBrokerId(),
                limits.getMaxLeverage(), limits.getMaxPositionNotional(), limits.getMaxOpenPositions(),
                limits.getRiskScore(), limits.getRiskTier(), limits.getUpdatedAt());
    }
}

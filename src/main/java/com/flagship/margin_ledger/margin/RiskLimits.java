package com.flagship.margin_ledger.margin;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Per-user trading limits, keyed by (userId, tenantId, brokerId).
 */
@Value
@Builder(toBuilder = true)
public class RiskLimits {
    String userId;
    String tenantId;
    String brokerId;
    int maxLeverage;
    BigDecimal maxPositionNotional;
    int maxOpenPositions;
    int riskScore;
    RiskTier riskTier;
    Instant createdAt;
    Instant updatedAt;

    public static String key(String userId, String tenantId, String brokerId) {
        return userId + "|" + tenantId + "|" + brokerId;
    }

    public String key() {
        return key(userId, tenantId, brokerId);
    }
}

package com.flagship.margin_ledger.ledger;

import com.flagship.margin_ledger.common.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Request to reserve part of an account's available balance.
 * {@code expiresAt} is optional; a hold without it stays ACTIVE until released.
 */
@Value
@Builder
public class HoldRequest {
    String tenantId;
    String accountId;
    BigDecimal amount;
    CurrencyCode currency;
    String description;
    Instant expiresAt;
    Map<String, String> metadata;
}

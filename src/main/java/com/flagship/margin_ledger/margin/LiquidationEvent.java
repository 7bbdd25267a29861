package com.flagship.margin_ledger.margin;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Record of one executed liquidation.
 */
@Value
@Builder
public class LiquidationEvent {

    public enum Status {
        EXECUTED
    }

    UUID id;
    UUID positionId;
    String accountId;
    String userId;
    String tenantId;
    String brokerId;
    String symbol;
    BigDecimal liquidationPrice;
    BigDecimal liquidationAmount;
    BigDecimal liquidationValue;
    BigDecimal realizedPnl;
    BigDecimal penaltyFee;
    BigDecimal remainingMargin;
    BigDecimal marginRatio;
    LiquidationReason reason;
    Status status;
    UUID journalEntryId;
    Instant triggeredAt;
    Instant executedAt;
}

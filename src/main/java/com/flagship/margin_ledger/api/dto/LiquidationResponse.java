package com.flagship.margin_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.margin_ledger.margin.LiquidationEvent;
import com.flagship.margin_ledger.margin.LiquidationReason;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class LiquidationResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("position_id")
    UUID positionId;

    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("symbol")
    String symbol;

    @JsonProperty("liquidation_price")
    BigDecimal liquidationPrice;

    @JsonProperty("liquidation_amount")
    BigDecimal liquidationAmount;

    @JsonProperty("liquidation_value")
    BigDecimal liquidationValue;

    @JsonProperty("realized_pnl")
    BigDecimal realizedPnl;

    @JsonProperty("penalty_fee")
    BigDecimal penaltyFee;

    @JsonProperty("remaining_margin")
    BigDecimal remainingMargin;

    @JsonProperty("margin_ratio")
    BigDecimal marginRatio;

    @JsonProperty("reason")
    LiquidationReason reason;

    @JsonProperty("status")
    String status;

    @JsonProperty("journal_entry_id")
    UUID journalEntryId;

    @JsonProperty("triggered_at")
    Instant triggeredAt;

    @JsonProperty("executed_at")
    Instant executedAt;

    public static LiquidationResponse from(LiquidationEvent event) {
        return LiquidationResponse.builder()
                .id(event.getId())
                .positionId(event.getPositionId())
                .accountId(event.getAccountId())
                .symbol(event.getSymbol())
                .liquidationPrice(event.getLiquidationPrice())
                .liquidationAmount(event.getLiquidationAmount())
                .liquidationValue(event.getLiquidationValue())
                .realizedPnl(event.getRealizedPnl())
                .penaltyFee(event.getPenaltyFee())
                .remainingMargin(event.getRemainingMargin())
                .marginRatio(event.getMarginRatio())
                .reason(event.getReason())
                .status(event.getStatus().name())
                .journalEntryId(event.getJournalEntryId())
                .triggeredAt(event.getTriggeredAt())
                .executedAt(event.getExecutedAt())
                .build();
    }
}

package com.flagship.margin_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.margin_ledger.margin.MarginPosition;
import com.flagship.margin_ledger.margin.OrderType;
import com.flagship.margin_ledger.margin.PositionSide;
import com.flagship.margin_ledger.margin.PositionStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PositionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("symbol")
    String symbol;

    @JsonProperty("side")
    PositionSide side;

    @JsonProperty("order_type")
    OrderType orderType;

    @JsonProperty("size")
    BigDecimal size;

    @JsonProperty("entry_price")
    BigDecimal entryPrice;

    @JsonProperty("current_price")
    BigDecimal currentPrice;

    @JsonProperty("leverage")
    int leverage;

    @JsonProperty("initial_margin")
    BigDecimal initialMargin;

    @JsonProperty("maintenance_margin")
    BigDecimal maintenanceMargin;

    @JsonProperty("liquidation_price")
    BigDecimal liquidationPrice;

    @JsonProperty("unrealized_pnl")
    BigDecimal unrealizedPnl;

    @JsonProperty("realized_pnl")
    BigDecimal realizedPnl;

    @JsonProperty("hold_id")
    UUID holdId;

    @JsonProperty("status")
    PositionStatus status;

    @JsonProperty("opened_at")
    Instant openedAt;

    @JsonProperty("closed_at")
    Instant closedAt;

    public static PositionResponse from(MarginPosition position) {
        return PositionResponse.builder()
                .id(position.getId())
                .accountId(position.getAccountId())
                .symbol(position.getSymbol())
                .side(position.getSide())
                .orderType(position.getOrderType())
                .size(position.getSize())
                .entryPrice(position.getEntryPrice())
                .currentPrice(position.getCurrentPrice())
                .leverage(position.getLeverage())
                .initialMargin(position.getInitialMargin())
                .maintenanceMargin(position.getMaintenanceMargin())
                .liquidationPrice(position.getLiquidationPrice())
                .unrealizedPnl(position.getUnrealizedPnl())
                .realizedPnl(position.getRealizedPnl())
                .holdId(position.getHoldId())
                .status(position.getStatus())
                .openedAt(position.getOpenedAt())
                .closedAt(position.getClosedAt())
                .build();
    }
}

package com.flagship.margin_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.margin_ledger.margin.OrderType;
import com.flagship.margin_ledger.margin.PositionRequest;
import com.flagship.margin_ledger.margin.PositionSide;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class OpenPositionRequest {

    @NotBlank(message = "User ID is required")
    @JsonProperty("user_id")
    String userId;

    @NotBlank(message = "Tenant ID is required")
    @JsonProperty("tenant_id")
    String tenantId;

    @NotBlank(message = "Broker ID is required")
    @JsonProperty("broker_id")
    String brokerId;

    @NotBlank(message = "Account ID is required")
    @JsonProperty("account_id")
    String accountId;

    @NotBlank(message = "Symbol is required")
    @JsonProperty("symbol")
    String symbol;

    @NotNull(message = "Side is required")
    @JsonProperty("side")
    PositionSide side;

    @NotNull(message = "Size is required")
    @DecimalMin(value = "0", inclusive = false, message = "Size must be greater than 0")
    @JsonProperty("size")
    BigDecimal size;

    @Min(value = 1, message = "Leverage must be at least 1")
    @JsonProperty("leverage")
    int leverage;

    @JsonProperty("order_type")
    OrderType orderType;

    @JsonProperty("price")
    BigDecimal price;

    public PositionRequest toPositionRequest() {
        return PositionRequest.builder()
                .userId(userId)
                .tenantId(tenantId)
                .brokerId(brokerId)
                .accountId(accountId)
                .symbol(symbol)
                .side(side)
                .size(size)
                .leverage(leverage)
                .orderType(orderType == null ? OrderType.MARKET : orderType)
                .price(price)
                .build();
    }
}

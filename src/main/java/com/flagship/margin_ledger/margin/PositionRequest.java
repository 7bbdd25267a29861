package com.flagship.margin_ledger.margin;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Request to open a margin position. {@code price} is required for LIMIT orders and
 * ignored for MARKET orders, which take the current mark price.
 */
@Value
@Builder
public class PositionRequest {
    String userId;
    String tenantId;
    String brokerId;
    String accountId;
    String symbol;
    PositionSide side;
    BigDecimal size;
    int leverage;
    OrderType orderType;
    BigDecimal price;
}

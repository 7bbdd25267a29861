package com.flagship.margin_ledger.margin;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A leveraged position.
 *
 * Entry price, size and leverage never change after opening; a different size
 * means closing and reopening. The initial margin is reserved by a ledger hold
 * ({@code holdId}) until the position is closed or liquidated.
 *
 * State transitions:
 * - markClosing(): OPEN -> CLOSING
 * - reopen():      CLOSING -> OPEN
 * - close():       CLOSING -> CLOSED
 * - liquidate():   CLOSING -> LIQUIDATED
 */
@Value
@Builder(toBuilder = true)
public class MarginPosition {
    UUID id;
    String accountId;
    String userId;
    String tenantId;
    String brokerId;
    String symbol;
    PositionSide side;
    OrderType orderType;
    BigDecimal size;
    BigDecimal entryPrice;
    BigDecimal currentPrice;
    int leverage;
    BigDecimal initialMargin;
    BigDecimal maintenanceMargin;
    BigDecimal liquidationPrice;
    BigDecimal unrealizedPnl;
    BigDecimal realizedPnl;
    UUID holdId;
    PositionStatus status;
    Instant openedAt;
    Instant closedAt;
    Instant updatedAt;

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }

    /**
     * Revalues an open position at {@code price}.
     */
    public MarginPosition mark(BigDecimal price, BigDecimal unrealizedPnl, Instant now) {
        requireStatus(PositionStatus.OPEN, "mark");
        return toBuilder().currentPrice(price).unrealizedPnl(unrealizedPnl).updatedAt(now).build();
    }

    public MarginPosition markClosing(Instant now) {
        requireStatus(PositionStatus.OPEN, "close");
        return toBuilder().status(PositionStatus.CLOSING).updatedAt(now).build();
    }

    public MarginPosition reopen(Instant now) {
        requireStatus(PositionStatus.CLOSING, "reopen");
        return toBuilder().status(PositionStatus.OPEN).updatedAt(now).build();
    }

    public MarginPosition close(BigDecimal price, BigDecimal realizedPnl, Instant now) {
        return settle(PositionStatus.CLOSED, price, realizedPnl, now);
    }

    public MarginPosition liquidate(BigDecimal price, BigDecimal realizedPnl, Instant now) {
        return settle(PositionStatus.LIQUIDATED, price, realizedPnl, now);
    }

    private MarginPosition settle(PositionStatus target, BigDecimal price, BigDecimal realizedPnl, Instant now) {
        requireStatus(PositionStatus.CLOSING, target.name().toLowerCase());
        return toBuilder()
            .status(target)
            .currentPrice(price)
            .realizedPnl(realizedPnl)
            .unrealizedPnl(BigDecimal.ZERO)
            .closedAt(now)
            .updatedAt(now)
            .build();
    }

    private void requireStatus(PositionStatus expected, String action) {
        if (status != expected) {
            throw new IllegalStateException(String.format(
                "Cannot %s position %s in status %s. Expected %s.", action, id, status, expected));
        }
    }
}

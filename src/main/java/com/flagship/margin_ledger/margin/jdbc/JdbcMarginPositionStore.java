package com.flagship.margin_ledger.margin.jdbc;

import com.flagship.margin_ledger.margin.MarginPosition;
import com.flagship.margin_ledger.margin.OrderType;
import com.flagship.margin_ledger.margin.PositionSide;
import com.flagship.margin_ledger.margin.PositionStatus;
import com.flagship.margin_ledger.margin.store.MarginPositionStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

public class JdbcMarginPositionStore implements MarginPositionStore {

    private static final String SELECT =
        "SELECT id, account_id, user_id, tenant_id, broker_id, symbol, side, order_type, size, entry_price, " +
        "current_price, leverage, initial_margin, maintenance_margin, liquidation_price, unrealized_pnl, " +
        "realized_pnl, hold_id, status, opened_at, closed_at, updated_at FROM margin_positions";

    private final JdbcTemplate jdbcTemplate;

    public JdbcMarginPositionStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void insert(MarginPosition position) {
        jdbcTemplate.update(
            "INSERT INTO margin_positions (id, account_id, user_id, tenant_id, broker_id, symbol, side, " +
            "order_type, size, entry_price, current_price, leverage, initial_margin, maintenance_margin, " +
            "liquidation_price, unrealized_pnl, realized_pnl, hold_id, status, opened_at, closed_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            position.getId(),
            position.getAccountId(),
            position.getUserId(),
            position.getTenantId(),
            position.getBrokerId(),
            position.getSymbol(),
            position.getSide().name(),
            position.getOrderType() == null ? null : position.getOrderType().name(),
            position.getSize(),
            position.getEntryPrice(),
            position.getCurrentPrice(),
            position.getLeverage(),
            position.getInitialMargin(),
            position.getMaintenanceMargin(),
            position.getLiquidationPrice(),
            position.getUnrealizedPnl(),
            position.getRealizedPnl(),
            position.getHoldId(),
            position.getStatus().name(),
            Timestamp.from(position.getOpenedAt()),
            toTimestamp(position.getClosedAt()),
            Timestamp.from(position.getUpdatedAt())
        );
    }

    /**
     * Writes the mutable columns; entry terms are fixed at insert.
     */
    @Override
    public void update(MarginPosition position) {
        int rows = jdbcTemplate.update(
            "UPDATE margin_positions SET current_price = ?, unrealized_pnl = ?, realized_pnl = ?, hold_id = ?, " +
            "status = ?, closed_at = ?, updated_at = ? WHERE id = ?",
            position.getCurrentPrice(),
            position.getUnrealizedPnl(),
            position.getRealizedPnl(),
            position.getHoldId(),
            position.getStatus().name(),
            toTimestamp(position.getClosedAt()),
            Timestamp.from(position.getUpdatedAt()),
            position.getId()
        );
        if (rows != 1) {
            throw new IllegalStateException("Position not stored: " + position.getId());
        }
    }

    @Override
    public Optional<MarginPosition> findById(UUID positionId) {
        return jdbcTemplate.query(SELECT + " WHERE id = ?", positionRowMapper(), positionId)
            .stream().findFirst();
    }

    @Override
    public List<MarginPosition> findByAccount(String accountId, PositionStatus status) {
        if (status == null) {
            return jdbcTemplate.query(SELECT + " WHERE account_id = ? ORDER BY opened_at, id",
                positionRowMapper(), accountId);
        }
        return jdbcTemplate.query(SELECT + " WHERE account_id = ? AND status = ? ORDER BY opened_at, id",
            positionRowMapper(), accountId, status.name());
    }

    @Override
    public List<MarginPosition> findOpenBySymbol(String symbol) {
        return jdbcTemplate.query(SELECT + " WHERE symbol = ? AND status = 'OPEN' ORDER BY opened_at, id",
            positionRowMapper(), symbol);
    }

    @Override
    public Set<String> findOpenSymbols() {
        return new TreeSet<>(jdbcTemplate.queryForList(
            "SELECT DISTINCT symbol FROM margin_positions WHERE status = 'OPEN'", String.class));
    }

    private RowMapper<MarginPosition> positionRowMapper() {
        return (rs, rowNum) -> {
            String orderType = rs.getString("order_type");
            Timestamp closedAt = rs.getTimestamp("closed_at");
            return MarginPosition.builder()
                .id(rs.getObject("id", UUID.class))
                .accountId(rs.getString("account_id"))
                .userId(rs.getString("user_id"))
                .tenantId(rs.getString("tenant_id"))
                .brokerId(rs.getString("broker_id"))
                .symbol(rs.getString("symbol"))
                .side(PositionSide.valueOf(rs.getString("side")))
                .orderType(orderType == null ? null : OrderType.valueOf(orderType))
                .size(rs.getBigDecimal("size"))
                .entryPrice(rs.getBigDecimal("entry_price"))
                .currentPrice(rs.getBigDecimal("current_price"))
                .leverage(rs.getInt("leverage"))
                .initialMargin(rs.getBigDecimal("initial_margin"))
                .maintenanceMargin(rs.getBigDecimal("maintenance_margin"))
                .liquidationPrice(rs.getBigDecimal("liquidation_price"))
                .unrealizedPnl(rs.getBigDecimal("unrealized_pnl"))
                .realizedPnl(rs.getBigDecimal("realized_pnl"))
                .holdId(rs.getObject("hold_id", UUID.class))
                .status(PositionStatus.valueOf(rs.getString("status")))
                .openedAt(rs.getTimestamp("opened_at").toInstant())
                .closedAt(closedAt == null ? null : closedAt.toInstant())
                .updatedAt(rs.getTimestamp("updated_at").toInstant())
                .build();
        };
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }
}

package com.flagship.margin_ledger.margin.jdbc;

import com.flagship.margin_ledger.margin.LiquidationEvent;
import com.flagship.margin_ledger.margin.LiquidationReason;
import com.flagship.margin_ledger.margin.store.LiquidationEventStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

public class JdbcLiquidationEventStore implements LiquidationEventStore {

    private static final String SELECT =
        "SELECT id, position_id, account_id, user_id, tenant_id, broker_id, symbol, liquidation_price, " +
        "liquidation_amount, liquidation_value, realized_pnl, penalty_fee, remaining_margin, margin_ratio, " +
        "reason, status, journal_entry_id, triggered_at, executed_at FROM liquidation_events";

    private final JdbcTemplate jdbcTemplate;

    public JdbcLiquidationEventStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void insert(LiquidationEvent event) {
        jdbcTemplate.update(
            "INSERT INTO liquidation_events (id, position_id, account_id, user_id, tenant_id, broker_id, symbol, " +
            "liquidation_price, liquidation_amount, liquidation_value, realized_pnl, penalty_fee, remaining_margin, " +
            "margin_ratio, reason, status, journal_entry_id, triggered_at, executed_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            event.getId(),
            event.getPositionId(),
            event.getAccountId(),
            event.getUserId(),
            event.getTenantId(),
            event.getBrokerId(),
            event.getSymbol(),
            event.getLiquidationPrice(),
            event.getLiquidationAmount(),
            event.getLiquidationValue(),
            event.getRealizedPnl(),
            event.getPenaltyFee(),
            event.getRemainingMargin(),
            event.getMarginRatio(),
            event.getReason().name(),
            event.getStatus().name(),
            event.getJournalEntryId(),
            Timestamp.from(event.getTriggeredAt()),
            Timestamp.from(event.getExecutedAt())
        );
    }

    @Override
    public List<LiquidationEvent> findByAccount(String accountId) {
        return jdbcTemplate.query(SELECT + " WHERE account_id = ? ORDER BY executed_at, id",
            eventRowMapper(), accountId);
    }

    private RowMapper<LiquidationEvent> eventRowMapper() {
        return (rs, rowNum) -> LiquidationEvent.builder()
            .id(rs.getObject("id", UUID.class))
            .positionId(rs.getObject("position_id", UUID.class))
            .accountId(rs.getString("account_id"))
            .userId(rs.getString("user_id"))
            .tenantId(rs.getString("tenant_id"))
            .brokerId(rs.getString("broker_id"))
            .symbol(rs.getString("symbol"))
            .liquidationPrice(rs.getBigDecimal("liquidation_price"))
            .liquidationAmount(rs.getBigDecimal("liquidation_amount"))
            .liquidationValue(rs.getBigDecimal("liquidation_value"))
            .realizedPnl(rs.getBigDecimal("realized_pnl"))
            .penaltyFee(rs.getBigDecimal("penalty_fee"))
            .remainingMargin(rs.getBigDecimal("remaining_margin"))
            .marginRatio(rs.getBigDecimal("margin_ratio"))
            .reason(LiquidationReason.valueOf(rs.getString("reason")))
            .status(LiquidationEvent.Status.valueOf(rs.getString("status")))
            .journalEntryId(rs.getObject("journal_entry_id", UUID.class))
            .triggeredAt(rs.getTimestamp("triggered_at").toInstant())
            .executedAt(rs.getTimestamp("executed_at").toInstant())
            .build();
    }
}

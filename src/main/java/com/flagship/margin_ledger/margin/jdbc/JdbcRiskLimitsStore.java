package com.flagship.margin_ledger.margin.jdbc;

import com.flagship.margin_ledger.margin.RiskLimits;
import com.flagship.margin_ledger.margin.RiskTier;
import com.flagship.margin_ledger.margin.store.RiskLimitsStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.util.Optional;

public class JdbcRiskLimitsStore implements RiskLimitsStore {

    private final JdbcTemplate jdbcTemplate;

    public JdbcRiskLimitsStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<RiskLimits> find(String userId, String tenantId, String brokerId) {
        return jdbcTemplate.query(
            "SELECT user_id, tenant_id, broker_id, max_leverage, max_position_notional, max_open_positions, " +
            "risk_score, risk_tier, created_at, updated_at FROM risk_limits " +
            "WHERE user_id = ? AND tenant_id = ? AND broker_id = ?",
            limitsRowMapper(), userId, tenantId, brokerId).stream().findFirst();
    }

    @Override
    public void save(RiskLimits limits) {
        jdbcTemplate.update(
            "INSERT INTO risk_limits (user_id, tenant_id, broker_id, max_leverage, max_position_notional, " +
            "max_open_positions, risk_score, risk_tier, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT (user_id, tenant_id, broker_id) DO UPDATE SET " +
            "max_leverage = EXCLUDED.max_leverage, max_position_notional = EXCLUDED.max_position_notional, " +
            "max_open_positions = EXCLUDED.max_open_positions, risk_score = EXCLUDED.risk_score, " +
            "risk_tier = EXCLUDED.risk_tier, updated_at = EXCLUDED.updated_at",
            limits.getUserId(),
            limits.getTenantId(),
            limits.getBrokerId(),
            limits.getMaxLeverage(),
            limits.getMaxPositionNotional(),
            limits.getMaxOpenPositions(),
            limits.getRiskScore(),
            limits.getRiskTier().name(),
            Timestamp.from(limits.getCreatedAt()),
            Timestamp.from(limits.getUpdatedAt())
        );
    }

    private RowMapper<RiskLimits> limitsRowMapper() {
        return (rs, rowNum) -> RiskLimits.builder()
            .userId(rs.getString("user_id"))
            .tenantId(rs.getString("tenant_id"))
            .brokerId(rs.getString("broker_id"))
            .maxLeverage(rs.getInt("max_leverage"))
            .maxPositionNotional(rs.getBigDecimal("max_position_notional"))
            .maxOpenPositions(rs.getInt("max_open_positions"))
            .riskScore(rs.getInt("risk_score"))
            .riskTier(RiskTier.valueOf(rs.getString("risk_tier")))
            .createdAt(rs.getTimestamp("created_at").toInstant())
            .updatedAt(rs.getTimestamp("updated_at").toInstant())
            .build();
    }
}

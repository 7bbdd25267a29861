package com.flagship.margin_ledger.ledger.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.margin_ledger.common.CurrencyCode;
import com.flagship.margin_ledger.ledger.Hold;
import com.flagship.margin_ledger.ledger.HoldStatus;
import com.flagship.margin_ledger.ledger.store.HoldStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public class JdbcHoldStore implements HoldStore {

    private static final String SELECT =
        "SELECT id, tenant_id, account_id, amount, currency, description, status, expires_at, metadata, " +
        "created_at, released_at FROM ledger_holds";

    private final JdbcTemplate jdbcTemplate;
    private final MetadataCodec metadataCodec;

    public JdbcHoldStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.metadataCodec = new MetadataCodec(objectMapper);
    }

    @Override
    public void insert(Hold hold) {
        jdbcTemplate.update(
            "INSERT INTO ledger_holds (id, tenant_id, account_id, amount, currency, description, status, " +
            "expires_at, metadata, created_at, released_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            hold.getId(),
            hold.getTenantId(),
            hold.getAccountId(),
            hold.getAmount(),
            hold.getCurrency().name(),
            hold.getDescription(),
            hold.getStatus().name(),
            toTimestamp(hold.getExpiresAt()),
            metadataCodec.write(hold.getMetadata()),
            Timestamp.from(hold.getCreatedAt()),
            toTimestamp(hold.getReleasedAt())
        );
    }

    @Override
    public void update(Hold hold) {
        int rows = jdbcTemplate.update(
            "UPDATE ledger_holds SET status = ?, released_at = ? WHERE id = ?",
            hold.getStatus().name(),
            toTimestamp(hold.getReleasedAt()),
            hold.getId()
        );
        if (rows != 1) {
            throw new IllegalStateException("Hold not stored: " + hold.getId());
        }
    }

    @Override
    public Optional<Hold> findById(UUID holdId) {
        return jdbcTemplate.query(SELECT + " WHERE id = ?", holdRowMapper(), holdId).stream().findFirst();
    }

    @Override
    public List<Hold> findActiveByAccount(String accountId) {
        return jdbcTemplate.query(SELECT + " WHERE account_id = ? AND status = 'ACTIVE' ORDER BY created_at",
            holdRowMapper(), accountId);
    }

    @Override
    public List<Hold> findByTenant(String tenantId, HoldStatus status) {
        if (status == null) {
            return jdbcTemplate.query(SELECT + " WHERE tenant_id = ? ORDER BY created_at", holdRowMapper(), tenantId);
        }
        return jdbcTemplate.query(SELECT + " WHERE tenant_id = ? AND status = ? ORDER BY created_at",
            holdRowMapper(), tenantId, status.name());
    }

    @Override
    public List<Hold> findDue(Instant now) {
        return jdbcTemplate.query(
            SELECT + " WHERE status = 'ACTIVE' AND expires_at IS NOT NULL AND expires_at <= ?",
            holdRowMapper(), Timestamp.from(now));
    }

    private RowMapper<Hold> holdRowMapper() {
        return (rs, rowNum) -> {
            CurrencyCode currency = CurrencyCode.valueOf(rs.getString("currency"));
            Timestamp expiresAt = rs.getTimestamp("expires_at");
            Timestamp releasedAt = rs.getTimestamp("released_at");
            return new Hold(
                rs.getObject("id", UUID.class),
                rs.getString("tenant_id"),
                rs.getString("account_id"),
                currency.normalize(rs.getBigDecimal("amount")),
                currency,
                rs.getString("description"),
                HoldStatus.valueOf(rs.getString("status")),
                expiresAt == null ? null : expiresAt.toInstant(),
                metadataCodec.read(rs.getString("metadata")),
                rs.getTimestamp("created_at").toInstant(),
                releasedAt == null ? null : releasedAt.toInstant()
            );
        };
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }
}

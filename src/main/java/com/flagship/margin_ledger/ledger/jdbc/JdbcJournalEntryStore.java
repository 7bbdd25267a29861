package com.flagship.margin_ledger.ledger.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.margin_ledger.common.CurrencyCode;
import com.flagship.margin_ledger.ledger.JournalEntry;
import com.flagship.margin_ledger.ledger.JournalLine;
import com.flagship.margin_ledger.ledger.store.JournalEntryStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed journal. Entries and their lines are insert-only; the unique
 * constraint on {@code (tenant_id, idempotency_key)} backs the in-lock idempotency check.
 */
public class JdbcJournalEntryStore implements JournalEntryStore {

    private static final String SELECT_ENTRY =
        "SELECT id, tenant_id, description, idempotency_key, metadata, created_at FROM journal_entries";

    private final JdbcTemplate jdbcTemplate;
    private final MetadataCodec metadataCodec;

    public JdbcJournalEntryStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.metadataCodec = new MetadataCodec(objectMapper);
    }

    @Override
    public void insert(JournalEntry entry) {
        jdbcTemplate.update(
            "INSERT INTO journal_entries (id, tenant_id, description, idempotency_key, metadata, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?)",
            entry.getId(),
            entry.getTenantId(),
            entry.getDescription(),
            entry.getIdempotencyKey(),
            metadataCodec.write(entry.getMetadata()),
            Timestamp.from(entry.getCreatedAt())
        );

        List<JournalLine> lines = entry.getLines();
        for (int i = 0; i < lines.size(); i++) {
            JournalLine line = lines.get(i);
            jdbcTemplate.update(
                "INSERT INTO journal_lines (entry_id, line_no, account_id, debit, credit, currency, description) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?)",
                entry.getId(),
                i,
                line.getAccountId(),
                line.getDebit(),
                line.getCredit(),
                line.getCurrency().name(),
                line.getDescription()
            );
        }
    }

    @Override
    public Optional<JournalEntry> findById(UUID entryId) {
        return jdbcTemplate.query(SELECT_ENTRY + " WHERE id = ?", entryRowMapper(), entryId)
            .stream().findFirst();
    }

    @Override
    public Optional<JournalEntry> findByIdempotencyKey(String tenantId, String idempotencyKey) {
        return jdbcTemplate.query(SELECT_ENTRY + " WHERE tenant_id = ? AND idempotency_key = ?",
                entryRowMapper(), tenantId, idempotencyKey)
            .stream().findFirst();
    }

    @Override
    public List<JournalEntry> findByTenant(String tenantId, int limit, int offset) {
        return jdbcTemplate.query(SELECT_ENTRY + " WHERE tenant_id = ? ORDER BY seq DESC LIMIT ? OFFSET ?",
            entryRowMapper(), tenantId, limit, offset);
    }

    private List<JournalLine> findLines(UUID entryId) {
        return jdbcTemplate.query(
            "SELECT account_id, debit, credit, currency, description FROM journal_lines " +
            "WHERE entry_id = ? ORDER BY line_no",
            (rs, rowNum) -> {
                CurrencyCode currency = CurrencyCode.valueOf(rs.getString("currency"));
                return new JournalLine(
                    rs.getString("account_id"),
                    currency.normalize(rs.getBigDecimal("debit")),
                    currency.normalize(rs.getBigDecimal("credit")),
                    currency,
                    rs.getString("description"));
            },
            entryId);
    }

    private RowMapper<JournalEntry> entryRowMapper() {
        return (rs, rowNum) -> {
            UUID id = rs.getObject("id", UUID.class);
            return new JournalEntry(
                id,
                rs.getString("tenant_id"),
                rs.getString("description"),
                findLines(id),
                rs.getString("idempotency_key"),
                metadataCodec.read(rs.getString("metadata")),
                rs.getTimestamp("created_at").toInstant());
        };
    }
}

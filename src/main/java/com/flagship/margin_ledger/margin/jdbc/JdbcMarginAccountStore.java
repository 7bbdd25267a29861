package com.flagship.margin_ledger.margin.jdbc;

import com.flagship.margin_ledger.common.CurrencyCode;
import com.flagship.margin_ledger.margin.MarginAccount;
import com.flagship.margin_ledger.margin.MarginAccountStatus;
import com.flagship.margin_ledger.margin.MarginAccountType;
import com.flagship.margin_ledger.margin.store.MarginAccountStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed margin account store. One row per (user, tenant, broker),
 * enforced by {@code uq_margin_accounts_owner}.
 */
public class JdbcMarginAccountStore implements MarginAccountStore {

    private static final String SELECT =
        "SELECT id, user_id, tenant_id, broker_id, account_type, symbol, ledger_account_id, currency, " +
        "total_equity, used_margin, available_balance, margin_level, max_leverage, risk_score, status, " +
        "created_at, updated_at FROM margin_accounts";

    private final JdbcTemplate jdbcTemplate;

    public JdbcMarginAccountStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<MarginAccount> findById(String accountId) {
        return jdbcTemplate.query(SELECT + " WHERE id = ?", accountRowMapper(), accountId)
            .stream().findFirst();
    }

    @Override
    public Optional<MarginAccount> findByOwner(String userId, String tenantId, String brokerId) {
        return jdbcTemplate.query(SELECT + " WHERE user_id = ? AND tenant_id = ? AND broker_id = ?",
            accountRowMapper(), userId, tenantId, brokerId).stream().findFirst();
    }

    @Override
    public List<MarginAccount> findByStatus(MarginAccountStatus status) {
        return jdbcTemplate.query(SELECT + " WHERE status = ? ORDER BY created_at, id",
            accountRowMapper(), status.name());
    }

    @Override
    public void insert(MarginAccount account) {
        jdbcTemplate.update(
            "INSERT INTO margin_accounts (id, user_id, tenant_id, broker_id, account_type, symbol, " +
            "ledger_account_id, currency, total_equity, used_margin, available_balance, margin_level, " +
            "max_leverage, risk_score, status, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            account.getId(),
            account.getUserId(),
            account.getTenantId(),
            account.getBrokerId(),
            account.getAccountType().name(),
            account.getSymbol(),
            account.getLedgerAccountId(),
            account.getCurrency().name(),
            account.getTotalEquity(),
            account.getUsedMargin(),
            account.getAvailableBalance(),
            account.getMarginLevel(),
            account.getMaxLeverage(),
            account.getRiskScore(),
            account.getStatus().name(),
            Timestamp.from(account.getCreatedAt()),
            Timestamp.from(account.getUpdatedAt())
        );
    }

    @Override
    public void update(MarginAccount account) {
        int rows = jdbcTemplate.update(
            "UPDATE margin_accounts SET total_equity = ?, used_margin = ?, available_balance = ?, " +
            "margin_level = ?, max_leverage = ?, risk_score = ?, status = ?, updated_at = ? WHERE id = ?",
            account.getTotalEquity(),
            account.getUsedMargin(),
            account.getAvailableBalance(),
            account.getMarginLevel(),
            account.getMaxLeverage(),
            account.getRiskScore(),
            account.getStatus().name(),
            Timestamp.from(account.getUpdatedAt()),
            account.getId()
        );
        if (rows != 1) {
            throw new IllegalStateException("Margin account not stored: " + account.getId());
        }
    }

    private RowMapper<MarginAccount> accountRowMapper() {
        return (rs, rowNum) -> MarginAccount.builder()
            .id(rs.getString("id"))
            .userId(rs.getString("user_id"))
            .tenantId(rs.getString("tenant_id"))
            .brokerId(rs.getString("broker_id"))
            .accountType(MarginAccountType.valueOf(rs.getString("account_type")))
            .symbol(rs.getString("symbol"))
            .ledgerAccountId(rs.getString("ledger_account_id"))
            .currency(CurrencyCode.valueOf(rs.getString("currency")))
            .totalEquity(rs.getBigDecimal("total_equity"))
            .usedMargin(rs.getBigDecimal("used_margin"))
            .availableBalance(rs.getBigDecimal("available_balance"))
            .marginLevel(rs.getBigDecimal("margin_level"))
            .maxLeverage(rs.getInt("max_leverage"))
            .riskScore(rs.getInt("risk_score"))
            .status(MarginAccountStatus.valueOf(rs.getString("status")))
            .createdAt(rs.getTimestamp("created_at").toInstant())
            .updatedAt(rs.getTimestamp("updated_at").toInstant())
            .build();
    }
}

package com.flagship.margin_ledger.ledger.jdbc;

import com.flagship.margin_ledger.common.CurrencyCode;
import com.flagship.margin_ledger.ledger.Account;
import com.flagship.margin_ledger.ledger.store.AccountStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed account store. Balances are stored, not derived; the
 * {@code ledger_accounts} check constraints repeat the no-overdraft rule.
 */
public class JdbcAccountStore implements AccountStore {

    private static final String SELECT =
        "SELECT id, tenant_id, currency, balance, available_balance, overdraft_allowed, status, " +
        "created_at, updated_at FROM ledger_accounts";

    private final JdbcTemplate jdbcTemplate;

    public JdbcAccountStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<Account> findById(String accountId) {
        return jdbcTemplate.query(SELECT + " WHERE id = ?", accountRowMapper(), accountId)
            .stream().findFirst();
    }

    @Override
    public List<Account> findByTenant(String tenantId) {
        return jdbcTemplate.query(SELECT + " WHERE tenant_id = ? ORDER BY id", accountRowMapper(), tenantId);
    }

    @Override
    public void insert(Account account) {
        jdbcTemplate.update(
            "INSERT INTO ledger_accounts (id, tenant_id, currency, balance, available_balance, " +
            "overdraft_allowed, status, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
            account.getId(),
            account.getTenantId(),
            account.getCurrency().name(),
            account.getBalance(),
            account.getAvailableBalance(),
            account.isOverdraftAllowed(),
            account.getStatus().name(),
            Timestamp.from(account.getCreatedAt()),
            Timestamp.from(account.getUpdatedAt())
        );
    }

    @Override
    public void update(Account account) {
        int rows = jdbcTemplate.update(
            "UPDATE ledger_accounts SET balance = ?, available_balance = ?, status = ?, updated_at = ? WHERE id = ?",
            account.getBalance(),
            account.getAvailableBalance(),
            account.getStatus().name(),
            Timestamp.from(account.getUpdatedAt()),
            account.getId()
        );
        if (rows != 1) {
            throw new IllegalStateException("Account not stored: " + account.getId());
        }
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> {
            CurrencyCode currency = CurrencyCode.valueOf(rs.getString("currency"));
            return new Account(
                rs.getString("id"),
                rs.getString("tenant_id"),
                currency,
                currency.normalize(rs.getBigDecimal("balance")),
                currency.normalize(rs.getBigDecimal("available_balance")),
                rs.getBoolean("overdraft_allowed"),
                Account.Status.valueOf(rs.getString("status")),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant()
            );
        };
    }
}

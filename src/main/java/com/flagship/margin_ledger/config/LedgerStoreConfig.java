package com.flagship.margin_ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.margin_ledger.ledger.jdbc.JdbcAccountStore;
import com.flagship.margin_ledger.ledger.jdbc.JdbcHoldStore;
import com.flagship.margin_ledger.ledger.jdbc.JdbcJournalEntryStore;
import com.flagship.margin_ledger.ledger.store.AccountStore;
import com.flagship.margin_ledger.ledger.store.HoldStore;
import com.flagship.margin_ledger.ledger.store.InMemoryAccountStore;
import com.flagship.margin_ledger.ledger.store.InMemoryHoldStore;
import com.flagship.margin_ledger.ledger.store.InMemoryJournalEntryStore;
import com.flagship.margin_ledger.ledger.store.JournalEntryStore;
import com.flagship.margin_ledger.margin.jdbc.JdbcLiquidationEventStore;
import com.flagship.margin_ledger.margin.jdbc.JdbcMarginAccountStore;
import com.flagship.margin_ledger.margin.jdbc.JdbcMarginPositionStore;
import com.flagship.margin_ledger.margin.jdbc.JdbcRiskLimitsStore;
import com.flagship.margin_ledger.margin.store.InMemoryLiquidationEventStore;
import com.flagship.margin_ledger.margin.store.InMemoryMarginAccountStore;
import com.flagship.margin_ledger.margin.store.InMemoryMarginPositionStore;
import com.flagship.margin_ledger.margin.store.InMemoryRiskLimitsStore;
import com.flagship.margin_ledger.margin.store.LiquidationEventStore;
import com.flagship.margin_ledger.margin.store.MarginAccountStore;
import com.flagship.margin_ledger.margin.store.MarginPositionStore;
import com.flagship.margin_ledger.margin.store.RiskLimitsStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Store wiring. {@code ledger.store.type} selects the ledger and margin stores together:
 * - memory (default): concurrent maps, no transactions
 * - jdbc: PostgreSQL through JdbcTemplate, one TransactionTemplate per ledger operation
 *
 * Margin positions reference ledger holds, so both sides always live in the same place.
 */
@Configuration
@Slf4j
public class LedgerStoreConfig {

    @Configuration
    @ConditionalOnProperty(name = "ledger.store.type", havingValue = "memory", matchIfMissing = true)
    static class MemoryLedgerStores {

        @Bean
        AccountStore accountStore() {
            log.info("Ledger store: in-memory");
            return new InMemoryAccountStore();
        }

        @Bean
        JournalEntryStore journalEntryStore() {
            return new InMemoryJournalEntryStore();
        }

        @Bean
        HoldStore holdStore() {
            return new InMemoryHoldStore();
        }

        @Bean
        TransactionOperations ledgerTransactions() {
            return TransactionOperations.withoutTransaction();
        }

        @Bean
        MarginAccountStore marginAccountStore() {
            return new InMemoryMarginAccountStore();
        }

        @Bean
        MarginPositionStore marginPositionStore() {
            return new InMemoryMarginPositionStore();
        }

        @Bean
        LiquidationEventStore liquidationEventStore() {
            return new InMemoryLiquidationEventStore();
        }

        @Bean
        RiskLimitsStore riskLimitsStore() {
            return new InMemoryRiskLimitsStore();
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "ledger.store.type", havingValue = "jdbc")
    static class JdbcLedgerStores {

        @Bean
        AccountStore accountStore(JdbcTemplate jdbcTemplate) {
            log.info("Ledger store: JDBC");
            return new JdbcAccountStore(jdbcTemplate);
        }

        @Bean
        JournalEntryStore journalEntryStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcJournalEntryStore(jdbcTemplate, objectMapper);
        }

        @Bean
        HoldStore holdStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcHoldStore(jdbcTemplate, objectMapper);
        }

        @Bean
        TransactionOperations ledgerTransactions(PlatformTransactionManager transactionManager) {
            return new TransactionTemplate(transactionManager);
        }

        @Bean
        MarginAccountStore marginAccountStore(JdbcTemplate jdbcTemplate) {
            return new JdbcMarginAccountStore(jdbcTemplate);
        }

        @Bean
        MarginPositionStore marginPositionStore(JdbcTemplate jdbcTemplate) {
            return new JdbcMarginPositionStore(jdbcTemplate);
        }

        @Bean
        LiquidationEventStore liquidationEventStore(JdbcTemplate jdbcTemplate) {
            return new JdbcLiquidationEventStore(jdbcTemplate);
        }

        @Bean
        RiskLimitsStore riskLimitsStore(JdbcTemplate jdbcTemplate) {
            return new JdbcRiskLimitsStore(jdbcTemplate);
        }
    }
}

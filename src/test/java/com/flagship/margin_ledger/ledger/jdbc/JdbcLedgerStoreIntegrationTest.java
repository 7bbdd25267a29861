package com.flagship.margin_ledger.ledger.jdbc;

import com.flagship.margin_ledger.common.CurrencyCode;
import com.flagship.margin_ledger.external.ConfiguredPriceSource;
import com.flagship.margin_ledger.ledger.AccountBalance;
import com.flagship.margin_ledger.ledger.Hold;
import com.flagship.margin_ledger.ledger.HoldRequest;
import com.flagship.margin_ledger.ledger.HoldStatus;
import com.flagship.margin_ledger.ledger.JournalEntry;
import com.flagship.margin_ledger.ledger.JournalLine;
import com.flagship.margin_ledger.ledger.LedgerService;
import com.flagship.margin_ledger.ledger.exception.InsufficientAvailableBalanceException;
import com.flagship.margin_ledger.ledger.store.AccountStore;
import com.flagship.margin_ledger.margin.CloseResult;
import com.flagship.margin_ledger.margin.LiquidationEvent;
import com.flagship.margin_ledger.margin.LiquidationReason;
import com.flagship.margin_ledger.margin.MarginAccount;
import com.flagship.margin_ledger.margin.MarginAccountType;
import com.flagship.margin_ledger.margin.MarginPosition;
import com.flagship.margin_ledger.margin.MarginPositionService;
import com.flagship.margin_ledger.margin.PositionRequest;
import com.flagship.margin_ledger.margin.PositionSide;
import com.flagship.margin_ledger.margin.PositionStatus;
import com.flagship.margin_ledger.margin.RiskLimits;
import com.flagship.margin_ledger.margin.jdbc.JdbcLiquidationEventStore;
import com.flagship.margin_ledger.margin.jdbc.JdbcMarginAccountStore;
import com.flagship.margin_ledger.margin.jdbc.JdbcMarginPositionStore;
import com.flagship.margin_ledger.margin.jdbc.JdbcRiskLimitsStore;
import com.flagship.margin_ledger.margin.store.MarginPositionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Ledger engine and margin records against PostgreSQL: the JDBC stores must keep the
 * same guarantees as the in-memory ones, including rollback of a rejected posting.
 * Margin records are re-read through fresh store instances, as after a restart.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class JdbcLedgerStoreIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("test_ledger")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.sql.init.mode", () -> "always");
        registry.add("ledger.store.type", () -> "jdbc");
    }

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private AccountStore accountStore;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private MarginPositionService marginPositionService;

    @Autowired
    private MarginPositionStore marginPositionStore;

    @Autowired
    private ConfiguredPriceSource priceSource;

    private String tenantId;
    private String funding;
    private String wallet;

    @BeforeEach
    void setUp() {
        tenantId = "tenant-" + UUID.randomUUID().toString().substring(0, 8);
        funding = tenantId + ":funding:USD";
        wallet = tenantId + ":wallet";
        ledgerService.openAccount(tenantId, funding, CurrencyCode.USD, true);
        ledgerService.openAccount(tenantId, wallet, CurrencyCode.USD, false);
    }

    private MarginPosition openBtcLong(MarginAccount account, String size) {
        return marginPositionService.createMarginPosition(PositionRequest.builder()
            .userId(account.getUserId())
            .tenantId(account.getTenantId())
            .brokerId(account.getBrokerId())
            .accountId(account.getId())
            .symbol("BTC/USDT")
            .side(PositionSide.LONG)
            .size(new BigDecimal(size))
            .leverage(10)
            .build());
    }

    private JournalEntry transfer(String from, String to, String amount, String key) {
        return ledgerService.postJournalEntry(tenantId, "transfer", List.of(
            JournalLine.debit(from, new BigDecimal(amount), CurrencyCode.USD, null),
            JournalLine.credit(to, new BigDecimal(amount), CurrencyCode.USD, null)), key, Map.of("channel", "test"));
    }

    @Test
    @DisplayName("Accounts are stored through JdbcAccountStore")
    void usesJdbcStores() {
        assertInstanceOf(JdbcAccountStore.class, accountStore);
        Integer rows = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_accounts WHERE tenant_id = ?", Integer.class, tenantId);
        assertEquals(2, rows);
    }

    @Test
    @DisplayName("Entries, lines and metadata round-trip through PostgreSQL")
    void postAndReload() {
        JournalEntry posted = transfer(funding, wallet, "125.50", "deposit-1");

        JournalEntry loaded = ledgerService.getJournalEntry(posted.getId());
        assertEquals(2, loaded.getLines().size());
        assertEquals("deposit-1", loaded.getIdempotencyKey());
        assertEquals("test", loaded.getMetadata().get("channel"));

        AccountBalance balance = ledgerService.getAccountBalance(wallet);
        assertEquals(0, balance.getBalance().compareTo(new BigDecimal("125.50")));
    }

    @Test
    @DisplayName("An idempotency key replays the stored entry")
    void idempotentReplay() {
        JournalEntry first = transfer(funding, wallet, "10", "key-1");
        JournalEntry second = transfer(funding, wallet, "10", "key-1");

        assertEquals(first.getId(), second.getId());
        assertEquals(0, ledgerService.getAccountBalance(wallet).getBalance().compareTo(new BigDecimal("10")));
    }

    @Test
    @DisplayName("A rejected posting leaves no rows behind")
    void rejectedPostingRollsBack() {
        transfer(funding, wallet, "50", null);

        assertThrows(InsufficientAvailableBalanceException.class, () -> transfer(wallet, funding, "80", null));

        assertEquals(1, ledgerService.getJournalEntries(tenantId, 10, 0).size());
        assertEquals(0, ledgerService.getAccountBalance(wallet).getBalance().compareTo(new BigDecimal("50")));
    }

    @Test
    @DisplayName("Holds persist their status and reduce the available balance")
    void holdsPersist() {
        transfer(funding, wallet, "100", null);

        Hold hold = ledgerService.createHold(HoldRequest.builder()
            .tenantId(tenantId)
            .accountId(wallet)
            .amount(new BigDecimal("30"))
            .currency(CurrencyCode.USD)
            .description("reservation")
            .build());
        assertEquals(0, ledgerService.getAccountBalance(wallet).getAvailableBalance().compareTo(new BigDecimal("70")));

        ledgerService.releaseHold(hold.getId());

        assertEquals(List.of(), ledgerService.getHolds(tenantId, HoldStatus.ACTIVE));
        assertEquals(HoldStatus.RELEASED, ledgerService.getHolds(tenantId, HoldStatus.RELEASED).get(0).getStatus());
        assertEquals(0, ledgerService.getAccountBalance(wallet).getAvailableBalance().compareTo(new BigDecimal("100")));
    }

    @Test
    @DisplayName("Margin accounts, positions and risk limits survive a fresh set of stores")
    void marginRecordsPersist() {
        // Given
        assertInstanceOf(JdbcMarginPositionStore.class, marginPositionStore);
        priceSource.updatePrice("BTC/USDT", new BigDecimal("45000"));
        MarginAccount account = marginPositionService.createMarginAccount(
            "user-1", tenantId, "broker-1", MarginAccountType.CROSS, null, new BigDecimal("10000"));

        // When: 0.1 BTC at 45000, 10x
        MarginPosition position = openBtcLong(account, "0.1");

        // Then: a new store reads back the open position and its hold
        MarginPosition reloaded = new JdbcMarginPositionStore(jdbcTemplate).findById(position.getId()).orElseThrow();
        assertEquals(PositionStatus.OPEN, reloaded.getStatus());
        assertEquals(position.getHoldId(), reloaded.getHoldId());
        assertEquals(0, reloaded.getEntryPrice().compareTo(new BigDecimal("45000")));
        assertEquals(0, reloaded.getInitialMargin().compareTo(new BigDecimal("450")));
        assertEquals(HoldStatus.ACTIVE, ledgerService.getHold(reloaded.getHoldId()).getStatus());

        MarginAccount reloadedAccount = new JdbcMarginAccountStore(jdbcTemplate)
            .findByOwner("user-1", tenantId, "broker-1").orElseThrow();
        assertEquals(account.getId(), reloadedAccount.getId());
        assertEquals(0, reloadedAccount.getUsedMargin().compareTo(new BigDecimal("450")));

        RiskLimits limits = new JdbcRiskLimitsStore(jdbcTemplate).find("user-1", tenantId, "broker-1").orElseThrow();
        assertEquals(5, limits.getMaxOpenPositions());

        // When: closed at 46000
        priceSource.updatePrice("BTC/USDT", new BigDecimal("46000"));
        CloseResult result = marginPositionService.closeMarginPosition("user-1", tenantId, "broker-1", position.getId());

        // Then
        MarginPosition closed = new JdbcMarginPositionStore(jdbcTemplate).findById(position.getId()).orElseThrow();
        assertEquals(PositionStatus.CLOSED, closed.getStatus());
        assertNotNull(closed.getClosedAt());
        assertEquals(0, closed.getRealizedPnl().compareTo(new BigDecimal("100")));
        assertEquals(0, result.getRealizedPnl().compareTo(new BigDecimal("100")));
        assertEquals(HoldStatus.RELEASED, ledgerService.getHold(position.getHoldId()).getStatus());
        assertEquals(List.of(), new JdbcMarginPositionStore(jdbcTemplate).findByAccount(account.getId(), PositionStatus.OPEN));
    }

    @Test
    @DisplayName("Liquidation events are stored with their settlement entry")
    void liquidationEventsPersist() {
        priceSource.updatePrice("BTC/USDT", new BigDecimal("45000"));
        MarginAccount account = marginPositionService.createMarginAccount(
            "user-2", tenantId, "broker-1", MarginAccountType.CROSS, null, new BigDecimal("10000"));
        MarginPosition position = openBtcLong(account, "0.1");

        LiquidationEvent event = marginPositionService.liquidatePosition(
            position.getId(), LiquidationReason.RISK_LIMIT_EXCEEDED);

        List<LiquidationEvent> stored = new JdbcLiquidationEventStore(jdbcTemplate).findByAccount(account.getId());
        assertEquals(1, stored.size());
        assertEquals(event.getId(), stored.get(0).getId());
        assertEquals(LiquidationReason.RISK_LIMIT_EXCEEDED, stored.get(0).getReason());
        assertEquals(0, stored.get(0).getPenaltyFee().compareTo(new BigDecimal("135")));
        assertNotNull(ledgerService.getJournalEntry(stored.get(0).getJournalEntryId()));
        assertEquals(PositionStatus.LIQUIDATED,
            new JdbcMarginPositionStore(jdbcTemplate).findById(position.getId()).orElseThrow().getStatus());
    }
}

package com.flagship.margin_ledger.support;

import com.flagship.margin_ledger.common.CurrencyCode;
import com.flagship.margin_ledger.ledger.AccountLockManager;
import com.flagship.margin_ledger.ledger.IdempotencyService;
import com.flagship.margin_ledger.ledger.JournalLine;
import com.flagship.margin_ledger.ledger.LedgerService;
import com.flagship.margin_ledger.ledger.store.InMemoryAccountStore;
import com.flagship.margin_ledger.ledger.store.InMemoryHoldStore;
import com.flagship.margin_ledger.ledger.store.InMemoryJournalEntryStore;
import com.flagship.margin_ledger.observability.LedgerMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.transaction.support.TransactionOperations;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A ledger wired on in-memory stores, for tests that don't need Spring.
 */
public class LedgerFixture {

    public static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    public final MutableClock clock = new MutableClock(START);
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final InMemoryAccountStore accountStore = new InMemoryAccountStore();
    public final InMemoryJournalEntryStore journalEntryStore = new InMemoryJournalEntryStore();
    public final InMemoryHoldStore holdStore = new InMemoryHoldStore();
    public final AccountLockManager lockManager;
    public final LedgerService ledgerService;

    public LedgerFixture() {
        this(5000);
    }

    public LedgerFixture(long lockWaitMillis) {
        this.lockManager = new AccountLockManager(lockWaitMillis);
        this.ledgerService = new LedgerService(
            accountStore,
            journalEntryStore,
            holdStore,
            lockManager,
            TransactionOperations.withoutTransaction(),
            new IdempotencyService(journalEntryStore, Optional.empty(), false),
            new LedgerMetrics(meterRegistry),
            clock);
    }

    /**
     * Moves {@code amount} from the tenant's overdraft funding account into {@code accountId}.
     */
    public void fund(String tenantId, String accountId, String amount, CurrencyCode currency) {
        String funding = tenantId + ":funding:" + currency;
        ledgerService.openAccount(tenantId, funding, currency, true);
        ledgerService.postJournalEntry(tenantId, "Funding " + accountId, List.of(
            JournalLine.debit(funding, new BigDecimal(amount), currency, "funding"),
            JournalLine.credit(accountId, new BigDecimal(amount), currency, "deposit")
        ), null, Map.of());
    }
}

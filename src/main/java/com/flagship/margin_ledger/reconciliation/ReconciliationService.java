package com.flagship.margin_ledger.reconciliation;

import com.flagship.margin_ledger.common.ValidationException;
import com.flagship.margin_ledger.external.ExternalLedgerClient;
import com.flagship.margin_ledger.external.ExternalServiceException;
import com.flagship.margin_ledger.external.ExternalTransactionReceipt;
import com.flagship.margin_ledger.external.ExternalTransactionRequest;
import com.flagship.margin_ledger.ledger.Account;
import com.flagship.margin_ledger.ledger.JournalEntry;
import com.flagship.margin_ledger.ledger.JournalLine;
import com.flagship.margin_ledger.ledger.LedgerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Compares internal balances with the external ledger and mirrors journal entries to it.
 *
 * A balance matches when the difference is within 0.01 absolute or within 0.1% of the
 * internal balance. External failures on one account are reported in the result instead
 * of aborting the run. Local postings never depend on the external ledger.
 */
@Service
@Slf4j
public class ReconciliationService {

    static final BigDecimal ABSOLUTE_TOLERANCE = new BigDecimal("0.01");
    static final BigDecimal RELATIVE_TOLERANCE_PERCENT = new BigDecimal("0.1");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final LedgerService ledgerService;
    private final ExternalLedgerClient externalLedgerClient;
    private final Clock clock;

    private final Set<String> runningTenants = ConcurrentHashMap.newKeySet();
    private final Map<UUID, String> exportedEntries = new ConcurrentHashMap<>();

    public ReconciliationService(LedgerService ledgerService, ExternalLedgerClient externalLedgerClient, Clock clock) {
        this.ledgerService = ledgerService;
        this.externalLedgerClient = externalLedgerClient;
        this.clock = clock;
    }

    /**
     * Reconciles every ACTIVE account of a tenant. A run already in progress for the
     * same tenant makes this call return a SKIPPED report.
     */
    public ReconciliationReport reconcileTenant(String tenantId) {
        ValidationException.requireText(tenantId, "tenantId");
        if (!runningTenants.add(tenantId)) {
            log.info("Reconciliation already running for tenant {}, skipping", tenantId);
            return ReconciliationReport.skipped(tenantId, clock.instant());
        }

        try {
            Instant startedAt = clock.instant();
            List<Discrepancy> discrepancies = new ArrayList<>();
            int checked = 0;
            for (Account account : ledgerService.getAccounts(tenantId)) {
                if (account.isClosed()) {
                    continue;
                }
                checked++;
                reconcileAccount(tenantId, account).ifPresent(discrepancies::add);
            }

            ReconciliationStatus status = discrepancies.isEmpty()
                ? ReconciliationStatus.MATCHED
                : ReconciliationStatus.DISCREPANCY;
            ReconciliationReport report = new ReconciliationReport(UUID.randomUUID(), tenantId, status, checked,
                List.copyOf(discrepancies), startedAt, clock.instant());

            if (status == ReconciliationStatus.MATCHED) {
                log.info("Reconciliation matched: tenant={}, accounts={}", tenantId, checked);
            } else {
                log.warn("Reconciliation found {} discrepancies: tenant={}, accounts={}",
                    discrepancies.size(), tenantId, checked);
            }
            return report;
        } finally {
            runningTenants.remove(tenantId);
        }
    }

    private Optional<Discrepancy> reconcileAccount(String tenantId, Account account) {
        BigDecimal expected = account.getBalance();
        BigDecimal actual;
        try {
            actual = externalLedgerClient
                .getAccountBalance(tenantId, account.getId(), account.getCurrency().name())
                .getNetBalance();
        } catch (ExternalServiceException e) {
            log.warn("External balance unavailable for account {}: {}", account.getId(), e.getMessage());
            return Optional.of(new Discrepancy(account.getId(), account.getCurrency().name(), expected,
                null, null, Discrepancy.Type.UNAVAILABLE, e.getMessage()));
        }

        BigDecimal difference = actual.subtract(expected);
        if (withinTolerance(expected, difference)) {
            return Optional.empty();
        }
        return Optional.of(new Discrepancy(account.getId(), account.getCurrency().name(), expected,
            actual, difference, Discrepancy.Type.BALANCE_MISMATCH,
            "Balance mismatch of " + difference.toPlainString()));
    }

    static boolean withinTolerance(BigDecimal expected, BigDecimal difference) {
        BigDecimal abs = difference.abs();
        if (abs.compareTo(ABSOLUTE_TOLERANCE) <= 0) {
            return true;
        }
        if (expected.signum() == 0) {
            return false;
        }
        BigDecimal percent = abs.multiply(HUNDRED).divide(expected.abs(), 8, RoundingMode.HALF_EVEN);
        return percent.compareTo(RELATIVE_TOLERANCE_PERCENT) <= 0;
    }

    /**
     * Mirrors a journal entry to the external ledger with {@code reference = entryId}.
     * A repeated export returns the remembered external id without calling out again.
     *
     * @return the external transaction id
     */
    public String exportJournalEntry(UUID entryId) {
        String known = exportedEntries.get(entryId);
        if (known != null) {
            return known;
        }

        JournalEntry entry = ledgerService.getJournalEntry(entryId);
        ExternalTransactionRequest.ExternalTransactionRequestBuilder request = ExternalTransactionRequest.builder()
            .tenantId(entry.getTenantId())
            .reference(entryId.toString())
            .description(entry.getDescription())
            .metadata(entry.getMetadata());
        for (JournalLine line : entry.getLines()) {
            request.entry(new ExternalTransactionRequest.Entry(line.getAccountId(), line.balanceEffect(),
                line.getCurrency().name(), line.getDescription(), entryId.toString()));
        }

        ExternalTransactionReceipt receipt = externalLedgerClient.recordTransaction(request.build());
        String previous = exportedEntries.putIfAbsent(entryId, receipt.getId());
        log.info("Journal entry exported: entryId={}, externalId={}", entryId, receipt.getId());
        return previous != null ? previous : receipt.getId();
    }
}

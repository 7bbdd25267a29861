package com.flagship.margin_ledger.reconciliation;

import com.flagship.margin_ledger.external.ExternalAccountBalance;
import com.flagship.margin_ledger.external.ExternalLedgerClient;
import com.flagship.margin_ledger.external.ExternalServiceException;
import com.flagship.margin_ledger.external.ExternalTransactionReceipt;
import com.flagship.margin_ledger.external.ExternalTransactionRequest;
import com.flagship.margin_ledger.ledger.JournalEntry;
import com.flagship.margin_ledger.ledger.JournalLine;
import com.flagship.margin_ledger.support.LedgerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static com.flagship.margin_ledger.common.CurrencyCode.USD;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReconciliationServiceTest {

    private static final String TENANT = "tenant-1";
    private static final String FUNDING = TENANT + ":funding:USD";

    @Mock
    private ExternalLedgerClient externalLedgerClient;

    private LedgerFixture fixture;
    private ReconciliationService reconciliationService;

    @BeforeEach
    void setUp() {
        fixture = new LedgerFixture();
        reconciliationService = new ReconciliationService(fixture.ledgerService, externalLedgerClient, fixture.clock);
    }

    private void externalBalance(String accountId, String amount) {
        when(externalLedgerClient.getAccountBalance(TENANT, accountId, "USD"))
            .thenReturn(new ExternalAccountBalance(accountId, new BigDecimal(amount), "USD"));
    }

    @Nested
    @DisplayName("Balance reconciliation")
    class Balances {

        @Test
        @DisplayName("Balances within tolerance match")
        void matched() {
            // Given: A holds 1000, funding -1000; external differs by one cent on A
            fixture.fund(TENANT, "A", "1000", USD);
            externalBalance("A", "1000.01");
            externalBalance(FUNDING, "-1000");

            // When
            ReconciliationReport report = reconciliationService.reconcileTenant(TENANT);

            // Then
            assertEquals(ReconciliationStatus.MATCHED, report.getStatus());
            assertEquals(2, report.getAccountsChecked());
            assertTrue(report.getDiscrepancies().isEmpty());
        }

        @Test
        @DisplayName("Mismatches beyond tolerance are reported with their difference")
        void mismatch() {
            fixture.fund(TENANT, "A", "1000", USD);
            externalBalance("A", "990");
            externalBalance(FUNDING, "-1000");

            ReconciliationReport report = reconciliationService.reconcileTenant(TENANT);

            assertEquals(ReconciliationStatus.DISCREPANCY, report.getStatus());
            assertEquals(1, report.getDiscrepancies().size());
            Discrepancy discrepancy = report.getDiscrepancies().get(0);
            assertEquals("A", discrepancy.getAccountId());
            assertEquals(Discrepancy.Type.BALANCE_MISMATCH, discrepancy.getType());
            assertEquals(0, discrepancy.getDifference().compareTo(new BigDecimal("-10")));
        }

        @Test
        @DisplayName("An unreachable external balance is recorded, not thrown")
        void unavailable() {
            fixture.fund(TENANT, "A", "1000", USD);
            when(externalLedgerClient.getAccountBalance(TENANT, "A", "USD"))
                .thenThrow(new ExternalServiceException("connection refused"));
            externalBalance(FUNDING, "-1000");

            ReconciliationReport report = reconciliationService.reconcileTenant(TENANT);

            assertEquals(ReconciliationStatus.DISCREPANCY, report.getStatus());
            assertEquals(Discrepancy.Type.UNAVAILABLE, report.getDiscrepancies().get(0).getType());
        }

        @Test
        @DisplayName("Tolerance is 0.01 absolute or 0.1 percent relative")
        void tolerance() {
            assertTrue(ReconciliationService.withinTolerance(new BigDecimal("5"), new BigDecimal("0.01")));
            assertTrue(ReconciliationService.withinTolerance(new BigDecimal("10000"), new BigDecimal("10")));
            assertFalse(ReconciliationService.withinTolerance(new BigDecimal("10000"), new BigDecimal("10.01")));
            assertFalse(ReconciliationService.withinTolerance(BigDecimal.ZERO, new BigDecimal("0.02")));
        }
    }

    @Nested
    @DisplayName("Journal export")
    class Export {

        @Test
        @DisplayName("Exported entries carry signed effects and are sent once")
        void exportOnce() {
            // Given
            fixture.ledgerService.openAccount(TENANT, FUNDING, USD, true);
            JournalEntry entry = fixture.ledgerService.postJournalEntry(TENANT, "deposit", List.of(
                JournalLine.debit(FUNDING, new BigDecimal("75"), USD, null),
                JournalLine.credit("A", new BigDecimal("75"), USD, null)), null, Map.of("source", "test"));
            when(externalLedgerClient.recordTransaction(any()))
                .thenReturn(new ExternalTransactionReceipt("ext-1", entry.getId().toString(), "APPLIED"));

            // When: exported twice
            String first = reconciliationService.exportJournalEntry(entry.getId());
            String second = reconciliationService.exportJournalEntry(entry.getId());

            // Then
            assertEquals("ext-1", first);
            assertEquals("ext-1", second);
            ArgumentCaptor<ExternalTransactionRequest> captor = ArgumentCaptor.forClass(ExternalTransactionRequest.class);
            verify(externalLedgerClient, times(1)).recordTransaction(captor.capture());
            ExternalTransactionRequest sent = captor.getValue();
            assertEquals(entry.getId().toString(), sent.getReference());
            assertEquals(TENANT, sent.getTenantId());
            assertEquals(0, sent.getEntries().get(0).getAmount().compareTo(new BigDecimal("-75")));
            assertEquals(0, sent.getEntries().get(1).getAmount().compareTo(new BigDecimal("75")));
        }

        @Test
        @DisplayName("Failed exports are not remembered")
        void failedExportRetried() {
            fixture.fund(TENANT, "A", "10", USD);
            JournalEntry entry = fixture.ledgerService.getJournalEntries(TENANT, 1, 0).get(0);
            when(externalLedgerClient.recordTransaction(any()))
                .thenThrow(new ExternalServiceException("timeout"))
                .thenReturn(new ExternalTransactionReceipt("ext-2", entry.getId().toString(), "APPLIED"));

            assertThrows(ExternalServiceException.class, () -> reconciliationService.exportJournalEntry(entry.getId()));
            assertEquals("ext-2", reconciliationService.exportJournalEntry(entry.getId()));
            verify(externalLedgerClient, times(2)).recordTransaction(any(ExternalTransactionRequest.class));
        }
    }
}

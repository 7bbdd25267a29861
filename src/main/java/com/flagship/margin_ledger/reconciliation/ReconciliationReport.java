package com.flagship.margin_ledger.reconciliation;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class ReconciliationReport {
    UUID id;
    String tenantId;
    ReconciliationStatus status;
    int accountsChecked;
    List<Discrepancy> discrepancies;
    Instant startedAt;
    Instant completedAt;

    public static ReconciliationReport skipped(String tenantId, Instant now) {
        return new ReconciliationReport(UUID.randomUUID(), tenantId, ReconciliationStatus.SKIPPED, 0, List.of(), now, now);
    }
}

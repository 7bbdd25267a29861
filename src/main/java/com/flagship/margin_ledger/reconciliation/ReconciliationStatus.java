package com.flagship.margin_ledger.reconciliation;

public enum ReconciliationStatus {
    MATCHED,
    DISCREPANCY,
    SKIPPED
}

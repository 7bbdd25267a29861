package com.flagship.margin_ledger.api;

import com.flagship.margin_ledger.reconciliation.ReconciliationReport;
import com.flagship.margin_ledger.reconciliation.ReconciliationService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.UUID;

/**
 * On-demand reconciliation against the external ledger.
 */
@RestController
@RequestMapping("/api/reconciliation")
@RequiredArgsConstructor
public class ReconciliationController {

    private final ReconciliationService reconciliationService;

    @PostMapping("/tenants/{tenantId}/run")
    public ReconciliationReport run(@PathVariable("tenantId") String tenantId) {
        return reconciliationService.reconcileTenant(tenantId);
    }

    @PostMapping("/journal-entries/{entryId}/export")
    public Map<String, String> export(@PathVariable("entryId") UUID entryId) {
        String externalId = reconciliationService.exportJournalEntry(entryId);
        return Map.of("journal_entry_id", entryId.toString(), "external_id", externalId);
    }
}

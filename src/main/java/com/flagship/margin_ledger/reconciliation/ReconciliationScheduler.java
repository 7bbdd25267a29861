package com.flagship.margin_ledger.reconciliation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs tenant reconciliation on a fixed schedule when
 * {@code reconciliation.scheduler.enabled=true}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "reconciliation.scheduler.enabled", havingValue = "true")
public class ReconciliationScheduler {

    private final ReconciliationService reconciliationService;

    @Value("${reconciliation.scheduler.tenants:}")
    private List<String> tenants;

    @Scheduled(fixedRateString = "${reconciliation.scheduler.interval-ms:3600000}")
    public void reconcile() {
        for (String tenantId : tenants) {
            ReconciliationReport report = reconciliationService.reconcileTenant(tenantId);
            log.info("Scheduled reconciliation: tenant={}, status={}, discrepancies={}",
                tenantId, report.getStatus(), report.getDiscrepancies().size());
        }
    }
}

package com.flagship.margin_ledger.margin.store;

import com.flagship.margin_ledger.margin.RiskLimits;

import java.util.Optional;

public interface RiskLimitsStore {

    Optional<RiskLimits> find(String userId, String tenantId, String brokerId);

    /**
     * Inserts or replaces the limits of the record's (user, tenant, broker).
     */
    void save(RiskLimits limits);
}

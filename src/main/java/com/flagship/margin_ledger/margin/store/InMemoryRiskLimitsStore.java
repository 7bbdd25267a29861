package com.flagship.margin_ledger.margin.store;

import com.flagship.margin_ledger.margin.RiskLimits;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryRiskLimitsStore implements RiskLimitsStore {

    private final Map<String, RiskLimits> limits = new ConcurrentHashMap<>();

    @Override
    public Optional<RiskLimits> find(String userId, String tenantId, String brokerId) {
        return Optional.ofNullable(limits.get(RiskLimits.key(userId, tenantId, brokerId)));
    }

    @Override
    public void save(RiskLimits riskLimits) {
        limits.put(riskLimits.key(), riskLimits);
    }
}

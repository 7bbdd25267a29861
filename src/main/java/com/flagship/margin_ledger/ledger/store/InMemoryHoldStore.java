package com.flagship.margin_ledger.ledger.store;

import com.flagship.margin_ledger.ledger.Hold;
import com.flagship.margin_ledger.ledger.HoldStatus;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryHoldStore implements HoldStore {

    private final Map<UUID, Hold> holds = new ConcurrentHashMap<>();

    @Override
    public void insert(Hold hold) {
        if (holds.putIfAbsent(hold.getId(), hold) != null) {
            throw new IllegalStateException("Hold already stored: " + hold.getId());
        }
    }

    @Override
    public void update(Hold hold) {
        if (holds.replace(hold.getId(), hold) == null) {
            throw new IllegalStateException("Hold not stored: " + hold.getId());
        }
    }

    @Override
    public Optional<Hold> findById(UUID holdId) {
        return Optional.ofNullable(holds.get(holdId));
    }

    @Override
    public List<Hold> findActiveByAccount(String accountId) {
        return holds.values().stream()
            .filter(h -> h.isActive() && h.getAccountId().equals(accountId))
            .sorted(Comparator.comparing(Hold::getCreatedAt))
            .toList();
    }

    @Override
    public List<Hold> findByTenant(String tenantId, HoldStatus status) {
        return holds.values().stream()
            .filter(h -> h.getTenantId().equals(tenantId))
            .filter(h -> status == null || h.getStatus() == status)
            .sorted(Comparator.comparing(Hold::getCreatedAt))
            .toList();
    }

    @Override
    public List<Hold> findDue(Instant now) {
        return holds.values().stream()
            .filter(h -> h.isDue(now))
            .toList();
    }
}

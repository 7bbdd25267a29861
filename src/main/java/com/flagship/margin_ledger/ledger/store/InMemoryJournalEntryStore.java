package com.flagship.margin_ledger.ledger.store;

import com.flagship.margin_ledger.ledger.JournalEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryJournalEntryStore implements JournalEntryStore {

    private final Map<UUID, JournalEntry> byId = new ConcurrentHashMap<>();
    private final Map<String, UUID> byIdempotencyKey = new ConcurrentHashMap<>();
    // insertion order, so newest-first listing is a reverse walk
    private final List<JournalEntry> log = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void insert(JournalEntry entry) {
        if (entry.getIdempotencyKey() != null) {
            UUID previous = byIdempotencyKey.putIfAbsent(
                idempotencyKey(entry.getTenantId(), entry.getIdempotencyKey()), entry.getId());
            if (previous != null) {
                throw new IllegalStateException("Duplicate idempotency key: " + entry.getIdempotencyKey());
            }
        }
        byId.put(entry.getId(), entry);
        log.add(entry);
    }

    @Override
    public Optional<JournalEntry> findById(UUID entryId) {
        return Optional.ofNullable(byId.get(entryId));
    }

    @Override
    public Optional<JournalEntry> findByIdempotencyKey(String tenantId, String idempotencyKey) {
        UUID id = byIdempotencyKey.get(idempotencyKey(tenantId, idempotencyKey));
        return id == null ? Optional.empty() : findById(id);
    }

    @Override
    public List<JournalEntry> findByTenant(String tenantId, int limit, int offset) {
        List<JournalEntry> snapshot;
        synchronized (log) {
            snapshot = new ArrayList<>(log);
        }
        Collections.reverse(snapshot);
        return snapshot.stream()
            .filter(e -> e.getTenantId().equals(tenantId))
            .skip(offset)
            .limit(limit)
            .toList();
    }

    private static String idempotencyKey(String tenantId, String key) {
        return tenantId + ":" + key;
    }
}

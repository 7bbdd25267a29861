package com.flagship.margin_ledger.ledger.store;

import com.flagship.margin_ledger.ledger.JournalEntry;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only persistence for journal entries.
 */
public interface JournalEntryStore {

    void insert(JournalEntry entry);

    Optional<JournalEntry> findById(UUID entryId);

    Optional<JournalEntry> findByIdempotencyKey(String tenantId, String idempotencyKey);

    /**
     * Entries of a tenant, newest first.
     */
    List<JournalEntry> findByTenant(String tenantId, int limit, int offset);
}

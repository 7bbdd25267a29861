package com.flagship.margin_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * An atomic, balanced, immutable set of postings.
 *
 * Invariant: for every currency, sum(debits) == sum(credits).
 */
@Value
public class JournalEntry {
    UUID id;
    String tenantId;
    String description;
    List<JournalLine> lines;
    String idempotencyKey;
    Map<String, String> metadata;
    Instant createdAt;

    public JournalEntry(UUID id, String tenantId, String description, List<JournalLine> lines,
                        String idempotencyKey, Map<String, String> metadata, Instant createdAt) {
        this.id = id;
        this.tenantId = tenantId;
        this.description = description;
        this.lines = List.copyOf(lines);
        this.idempotencyKey = idempotencyKey;
        this.metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        this.createdAt = createdAt;
    }
}

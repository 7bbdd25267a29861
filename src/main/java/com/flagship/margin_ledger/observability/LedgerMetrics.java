package com.flagship.margin_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Metrics for the ledger engine.
 *
 * Metrics exposed:
 * - ledger.entries.posted: journal entries written, tagged by currency
 * - ledger.idempotency: replay lookups, tagged hit / miss
 * - ledger.holds: hold lifecycle events, tagged by action
 * - ledger.rejections: refused operations, tagged by error kind
 * - ledger.posting.duration: time to post one entry, locks included
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Counter entriesPosted;
    private final Timer postingTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.entriesPosted = Counter.builder("ledger.entries.posted")
                .description("Number of journal entries posted")
                .register(registry);

        this.postingTimer = Timer.builder("ledger.posting.duration")
                .description("Time taken to post a journal entry")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordEntryPosted(String currency) {
        entriesPosted.increment();
        registry.counter("ledger.entries.posted.by_currency", "currency", sanitizeTag(currency)).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("ledger.idempotency", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("ledger.idempotency", "result", "miss").increment();
    }

    /**
     * Hold lifecycle: created, released, expired.
     */
    public void recordHold(String action, int count) {
        if (count > 0) {
            registry.counter("ledger.holds", "action", sanitizeTag(action)).increment(count);
        }
    }

    public void recordRejection(String kind) {
        registry.counter("ledger.rejections", "kind", sanitizeTag(kind)).increment();
    }

    public <T> T timePosting(Supplier<T> operation) {
        return postingTimer.record(operation);
    }

    static String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}

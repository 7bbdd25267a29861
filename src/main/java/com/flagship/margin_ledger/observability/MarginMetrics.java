package com.flagship.margin_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Metrics for the margin position manager.
 *
 * Metrics exposed:
 * - margin.positions: position lifecycle, tagged by action (opened, closed, liquidated) and symbol
 * - margin.status.changes: account status transitions, tagged by target status
 * - margin.rejections: refused position requests, tagged by error kind
 * - margin.position.duration: latency of open/close, tagged by operation
 */
@Component
public class MarginMetrics {

    private final MeterRegistry registry;

    public MarginMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPosition(String action, String symbol) {
        registry.counter("margin.positions",
                "action", LedgerMetrics.sanitizeTag(action),
                "symbol", LedgerMetrics.sanitizeTag(symbol)
        ).increment();
    }

    public void recordStatusChange(String status) {
        registry.counter("margin.status.changes", "status", LedgerMetrics.sanitizeTag(status)).increment();
    }

    public void recordRejection(String kind) {
        registry.counter("margin.rejections", "kind", LedgerMetrics.sanitizeTag(kind)).increment();
    }

    public <T> T time(String operation, Supplier<T> action) {
        Timer timer = registry.timer("margin.position.duration", "operation", LedgerMetrics.sanitizeTag(operation));
        return timer.record(action);
    }
}

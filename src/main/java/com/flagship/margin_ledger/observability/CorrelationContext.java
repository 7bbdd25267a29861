package com.flagship.margin_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Thread-local correlation id plus the MDC keys used by ledger and margin logging.
 *
 * The correlation id flows from the HTTP header into every log line of the request;
 * account and position ids are added for the duration of one operation.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ACCOUNT_ID_MDC_KEY = "accountId";
    public static final String POSITION_ID_MDC_KEY = "positionId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Gets the current correlation id, or generates a new one if not set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short id, readable in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Runs {@code action} with {@code key=value} in the MDC, restoring the previous value afterwards.
     * Nested calls for the same key (margin operation calling the ledger) keep the outer value on exit.
     */
    public static <T> T withMdc(String key, String value, Supplier<T> action) {
        String previous = MDC.get(key);
        MDC.put(key, value);
        try {
            return action.get();
        } finally {
            if (previous == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, previous);
            }
        }
    }
}

package com.flagship.wage_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local context for correlation ID propagation.
 *
 * The correlation ID flows from the HTTP request header into every log statement
 * (via MDC). Ledger and settlement mutations additionally tag their log lines with
 * the worker or settlement being processed.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String WORKER_ID_HEADER = "X-Worker-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String WORKER_ID_MDC_KEY = "workerId";
    public static final String SETTLEMENT_ID_MDC_KEY = "settlementId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Gets the current correlation ID, or generates a new one if not set.
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

    /**
     * Clears the correlation ID from the current thread.
     * Should be called at the end of request processing.
     */
    public static void clear() {
        correlationId.remove();
    }

    /**
     * Uses a shorter format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }

    /**
     * Tags log lines with the worker being mutated. Returns the previous value so
     * nested postings (a settlement line posting to the ledger) can restore it.
     */
    public static String putWorkerId(UUID workerId) {
        String previous = MDC.get(WORKER_ID_MDC_KEY);
        MDC.put(WORKER_ID_MDC_KEY, String.valueOf(workerId));
        return previous;
    }

    public static void restoreWorkerId(String previous) {
        if (previous == null) {
            MDC.remove(WORKER_ID_MDC_KEY);
        } else {
            MDC.put(WORKER_ID_MDC_KEY, previous);
        }
    }
}

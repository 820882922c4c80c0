package com.flagship.wage_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger, compensation and settlement operations.
 *
 * Metrics exposed:
 * - ledger.transactions: postings, tagged by kind and outcome
 * - ledger.reconciliation.drift: workers whose cached balance disagrees with history
 * - bonus.drafts.computed: drafts written by a recompute
 * - settlement.finalized: finalize attempts, tagged by kind and outcome
 * - ledger.operation.latency: timer per operation
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter driftDetected;
    private final Counter draftsComputed;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.driftDetected = Counter.builder("ledger.reconciliation.drift")
                .description("Reconciliations that found a cached balance or balance link mismatch")
                .register(registry);

        this.draftsComputed = Counter.builder("bonus.drafts.computed")
                .description("Bonus drafts written by a recompute")
                .register(registry);
    }

    /**
     * Records a ledger posting attempt.
     *
     * @param kind   transaction kind, e.g. ADVANCE
     * @param status {@code posted} or the rejection reason
     */
    public void recordTransaction(String kind, String status) {
        registry.counter("ledger.transactions",
                "kind", sanitizeTag(kind),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordSettlementFinalized(String kind, String status) {
        registry.counter("settlement.finalized",
                "kind", sanitizeTag(kind),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordBonusDraftsComputed(int count) {
        draftsComputed.increment(count);
    }

    public void recordDrift() {
        driftDetected.increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}

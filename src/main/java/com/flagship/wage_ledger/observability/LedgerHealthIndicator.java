package com.flagship.wage_ledger.observability;

import com.flagship.wage_ledger.ledger.LedgerService;
import com.flagship.wage_ledger.ledger.ReconciliationResult;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reports workers whose cached balance disagrees with their transaction history.
 * Drift is a data problem, not an outage, so it surfaces as WARNING rather than DOWN.
 */
@Component("ledgerHealth")
public class LedgerHealthIndicator implements HealthIndicator {

    private final LedgerService ledgerService;

    public LedgerHealthIndicator(LedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    @Override
    public Health health() {
        try {
            List<ReconciliationResult> results = ledgerService.reconcileAll();
            List<String> drifted = results.stream()
                    .filter(result -> !result.isConsistent())
                    .map(result -> result.getWorkerId().toString())
                    .toList();

            Health.Builder builder = drifted.isEmpty() ? Health.up() : Health.status("WARNING");
            return builder
                    .withDetail("workersChecked", results.size())
                    .withDetail("driftedWorkers", drifted)
                    .build();

        } catch (Exception e) {
            return Health.down()
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }
}

package com.flagship.wage_ledger.health;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.flagship.wage_ledger.common.Money;
import com.flagship.wage_ledger.ledger.LedgerService;
import com.flagship.wage_ledger.ledger.ReconciliationResult;
import com.flagship.wage_ledger.ledger.WorkerBalance;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Service health for operators.
 *
 * DOWN (503) when the database is unreachable. DEGRADED (200) when any worker's cached
 * advance balance disagrees with their transaction history; the ledger block then lists
 * the drifted workers. The outstanding advance total is the sum over active workers.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final LedgerService ledgerService;

    public HealthController(DataSource dataSource, LedgerService ledgerService) {
        this.dataSource = dataSource;
        this.ledgerService = ledgerService;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        Map<String, Object> ledger = checkLedger();
        response.put("ledger", ledger);
        if ("DRIFT".equals(ledger.get("status"))) {
            response.put("status", "DEGRADED");
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private Map<String, Object> checkLedger() {
        Map<String, Object> ledger = new LinkedHashMap<>();
        try {
            List<ReconciliationResult> results = ledgerService.reconcileAll();
            List<String> drifted = results.stream()
                    .filter(result -> !result.isConsistent())
                    .map(result -> result.getWorkerId().toString())
                    .toList();
            BigDecimal outstanding = ledgerService.summary().stream()
                    .map(WorkerBalance::getAdvanceBalance)
                    .reduce(Money.zero(), BigDecimal::add);

            ledger.put("status", drifted.isEmpty() ? "CONSISTENT" : "DRIFT");
            ledger.put("workers_checked", results.size());
            ledger.put("drifted_workers", drifted);
            ledger.put("outstanding_advance", outstanding);
        } catch (Exception e) {
            log.warn("Ledger health check failed: {}", e.getMessage());
            ledger.put("status", "UNKNOWN");
        }
        return ledger;
    }
}

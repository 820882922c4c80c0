package com.flagship.wage_ledger.settlement;

import com.flagship.wage_ledger.compensation.salary.dto.SalaryDraftRequest;
import com.flagship.wage_ledger.settlement.dto.FinalizeBonusRequest;
import com.flagship.wage_ledger.settlement.dto.SettlementHistoryResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * REST Controller for settlements.
 *
 * Finalizing posts deposits and new advances to the ledger as one unit; a failure
 * answers 422 naming the worker and leaves nothing behind.
 */
@RestController
@RequestMapping("/api/settlements")
@RequiredArgsConstructor
@Slf4j
public class SettlementController {

    private final SettlementService settlementService;

    @PostMapping("/bonus")
    public ResponseEntity<SettlementHistoryResponse> finalizeBonus(@Valid @RequestBody FinalizeBonusRequest request) {
        SettlementHistory history = settlementService.finalizeBonus(request.getPeriod().toPeriod(), request.getNotes());
        return ResponseEntity.status(HttpStatus.CREATED).body(SettlementHistoryResponse.from(history));
    }

    @PostMapping("/salary")
    public ResponseEntity<SettlementHistoryResponse> finalizeSalary(@Valid @RequestBody SalaryDraftRequest request) {
        SettlementHistory history = settlementService.finalizeSalary(
            request.getPeriod().toPeriod(), request.adjustmentsByWorker(), request.getNotes());
        return ResponseEntity.status(HttpStatus.CREATED).body(SettlementHistoryResponse.from(history));
    }

    @GetMapping
    public List<SettlementHistoryResponse> listHistory(
            @RequestParam(name = "kind", required = false) SettlementKind kind,
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        SettlementFilter filter = SettlementFilter.builder().kind(kind).from(from).to(to).build();
        return settlementService.listHistory(filter).stream()
            .map(SettlementHistoryResponse::from)
            .toList();
    }

    @GetMapping("/{id}")
    public SettlementHistoryResponse getHistory(@PathVariable("id") UUID id) {
        return SettlementHistoryResponse.from(settlementService.getHistory(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteHistory(@PathVariable("id") UUID id) {
        settlementService.deleteHistory(id);
        log.info("Settlement snapshot {} deleted on request", id);
        return ResponseEntity.noContent().build();
    }
}

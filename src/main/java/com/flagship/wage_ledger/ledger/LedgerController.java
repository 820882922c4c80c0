package com.flagship.wage_ledger.ledger;

import com.flagship.wage_ledger.ledger.dto.LedgerPostingRequest;
import com.flagship.wage_ledger.ledger.dto.LedgerTransactionResponse;
import com.flagship.wage_ledger.ledger.dto.ReconciliationResponse;
import com.flagship.wage_ledger.ledger.dto.WorkerBalanceResponse;
import com.flagship.wage_ledger.ledger.dto.WorkerLedgerResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
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
 * REST Controller for the advance ledger.
 *
 * Postings return 201 with the stored transaction, including the balance it produced.
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    private final LedgerService ledgerService;

    @PostMapping("/advance")
    public ResponseEntity<LedgerTransactionResponse> giveAdvance(@Valid @RequestBody LedgerPostingRequest request) {
        return post(TransactionKind.ADVANCE, request);
    }

    @PostMapping("/repayment")
    public ResponseEntity<LedgerTransactionResponse> recordRepayment(@Valid @RequestBody LedgerPostingRequest request) {
        return post(TransactionKind.REPAYMENT, request);
    }

    @PostMapping("/deposit")
    public ResponseEntity<LedgerTransactionResponse> recordDeposit(@Valid @RequestBody LedgerPostingRequest request) {
        return post(TransactionKind.DEPOSIT, request);
    }

    @GetMapping("/workers/{workerId}")
    public WorkerLedgerResponse getHistory(@PathVariable("workerId") UUID workerId) {
        List<LedgerTransactionResponse> history = ledgerService.getHistory(workerId).stream()
            .map(LedgerTransactionResponse::from)
            .toList();
        return WorkerLedgerResponse.builder()
            .workerId(workerId)
            .balance(ledgerService.getBalance(workerId))
            .transactions(history)
            .build();
    }

    @GetMapping("/workers/{workerId}/reconciliation")
    public ReconciliationResponse reconcile(@PathVariable("workerId") UUID workerId) {
        return ReconciliationResponse.from(ledgerService.reconcile(workerId));
    }

    @GetMapping("/transactions")
    public List<LedgerTransactionResponse> listTransactions(
            @RequestParam(name = "worker_id", required = false) UUID workerId,
            @RequestParam(name = "kind", required = false) TransactionKind kind,
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        TransactionFilter filter = TransactionFilter.builder()
            .workerId(workerId)
            .kind(kind)
            .from(from)
            .to(to)
            .build();
        return ledgerService.listTransactions(filter).stream()
            .map(LedgerTransactionResponse::from)
            .toList();
    }

    @GetMapping("/summary")
    public List<WorkerBalanceResponse> summary() {
        return ledgerService.summary().stream().map(WorkerBalanceResponse::from).toList();
    }

    private ResponseEntity<LedgerTransactionResponse> post(TransactionKind kind, LedgerPostingRequest request) {
        log.info("Received {} posting: workerId={}, amount={}", kind, request.getWorkerId(), request.getAmount());
        LedgerTransaction txn = ledgerService.appendTransaction(
            request.getWorkerId(), kind, request.getAmount(), request.getDate(), request.getNotes());
        return ResponseEntity.status(HttpStatus.CREATED).body(LedgerTransactionResponse.from(txn));
    }
}

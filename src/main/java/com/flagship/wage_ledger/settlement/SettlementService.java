package com.flagship.wage_ledger.settlement;

import com.flagship.wage_ledger.common.Money;
import com.flagship.wage_ledger.common.Period;
import com.flagship.wage_ledger.compensation.bonus.BonusDraft;
import com.flagship.wage_ledger.compensation.bonus.BonusService;
import com.flagship.wage_ledger.compensation.salary.SalaryAdjustment;
import com.flagship.wage_ledger.compensation.salary.SalaryDraft;
import com.flagship.wage_ledger.compensation.salary.SalaryService;
import com.flagship.wage_ledger.exception.NotFoundException;
import com.flagship.wage_ledger.exception.SettlementFailedException;
import com.flagship.wage_ledger.exception.ValidationException;
import com.flagship.wage_ledger.ledger.LedgerService;
import com.flagship.wage_ledger.ledger.TransactionKind;
import com.flagship.wage_ledger.observability.CorrelationContext;
import com.flagship.wage_ledger.observability.LedgerMetrics;
import com.flagship.wage_ledger.worker.Worker;
import com.flagship.wage_ledger.worker.WorkerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

/**
 * Finalizes bonus and salary settlements and keeps their snapshots.
 *
 * Batch policy: a finalize is one database transaction. Lines are posted in worker-code
 * order; the first worker whose posting fails aborts the batch with
 * {@link SettlementFailedException}, and every posting made earlier in the batch is
 * rolled back together with it. No snapshot is written for a failed batch.
 *
 * Finalize is the only path by which settlements reach the ledger. Deleting a snapshot
 * never reverses its postings.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementService {

    private static final LocalDate EARLIEST = LocalDate.of(1900, 1, 1);
    private static final LocalDate LATEST = LocalDate.of(9999, 12, 31);

    private final SettlementHistoryRepository historyRepository;
    private final LedgerService ledgerService;
    private final WorkerService workerService;
    private final BonusService bonusService;
    private final SalaryService salaryService;
    private final LedgerMetrics metrics;

    /**
     * Posts each line's deposit (debit) and new advance (credit) and stores the snapshot.
     *
     * Worker code and name on the snapshot come from the worker directory, not the caller.
     *
     * @throws ValidationException if there are no lines, a worker appears twice, or an amount is negative
     * @throws NotFoundException if a line names an unknown worker
     * @throws SettlementFailedException if a posting fails; nothing is persisted
     */
    @Transactional
    public SettlementHistory finalizeSettlement(SettlementKind kind, Period period,
                                                List<SettlementLine> lines, String notes) {
        if (kind == null) {
            throw new ValidationException("Settlement kind is required");
        }
        if (period == null) {
            throw new ValidationException("Settlement period is required");
        }
        if (lines == null || lines.isEmpty()) {
            throw new ValidationException("A settlement needs at least one worker line");
        }

        List<SettlementLine> ordered = orderedLines(lines);
        long start = System.currentTimeMillis();
        UUID settlementId = UUID.randomUUID();
        MDC.put(CorrelationContext.SETTLEMENT_ID_MDC_KEY, settlementId.toString());
        try {
            log.info("Finalizing {} settlement for {} with {} lines", kind, period, ordered.size());

            LocalDate today = LocalDate.now();
            List<SettlementLine> posted = new ArrayList<>();
            for (SettlementLine line : ordered) {
                posted.add(postLine(kind, period, line, today));
            }

            SettlementHistory history = snapshot(settlementId, kind, period, posted, notes);
            SettlementHistory saved = historyRepository.save(SettlementHistoryEntity.fromDomain(history)).toDomain();

            metrics.recordSettlementFinalized(kind.name(), "finalized");
            log.info("Finalized {} settlement {}: {} workers, deposits {}, new advances {}, paid out {}",
                kind, saved.getId(), saved.getWorkerCount(), saved.getTotalDeposit(),
                saved.getTotalNewAdvance(), saved.getTotalFinalAmount());
            return saved;
        } catch (SettlementFailedException e) {
            metrics.recordSettlementFinalized(kind.name(), "failed");
            log.warn("{} settlement for {} rolled back at worker {}: {}", kind, period, e.getWorkerCode(), e.getReason());
            throw e;
        } finally {
            metrics.recordLatency("finalize_settlement", System.currentTimeMillis() - start);
            MDC.remove(CorrelationContext.SETTLEMENT_ID_MDC_KEY);
        }
    }

    /**
     * Settles the stored bonus drafts of the period and freezes them.
     *
     * @throws ValidationException if the period has no stored drafts
     * @throws com.flagship.wage_ledger.exception.ConflictException if they are already finalized
     */
    @Transactional
    public SettlementHistory finalizeBonus(Period period, String notes) {
        List<BonusDraft> drafts = bonusService.finalizeDrafts(period);
        List<SettlementLine> lines = drafts.stream()
            .map(draft -> SettlementLine.builder()
                .workerId(draft.getWorkerId())
                .hourlyRate(draft.getHourlyRate())
                .baseAmount(draft.getBaseBonus())
                .hoursWorked(Money.zero())
                .daysWorked(draft.getDaysWorked())
                .daysAbsent(draft.getDaysAbsent())
                .penalty(draft.getPenalty())
                .extraBonus(draft.getExtraBonus())
                .deposit(draft.getEmployeeDeposit())
                .newAdvance(draft.getNewAdvance())
                .grossAmount(draft.getGrossBonus())
                .finalAmount(draft.getNetBonus())
                .build())
            .toList();
        return finalizeSettlement(SettlementKind.BONUS, period, lines, notes);
    }

    /**
     * Recomputes the salary drafts of the period with the given adjustments and settles them.
     */
    @Transactional
    public SettlementHistory finalizeSalary(Period period, Map<UUID, SalaryAdjustment> adjustments, String notes) {
        List<SalaryDraft> drafts = salaryService.computeSalaryDraft(period, adjustments);
        List<SettlementLine> lines = drafts.stream()
            .map(draft -> SettlementLine.builder()
                .workerId(draft.getWorkerId())
                .hourlyRate(draft.getHourlyRate())
                .baseAmount(draft.getTotalPay())
                .hoursWorked(draft.getTotalHours())
                .daysWorked(draft.getDaysPresent())
                .daysAbsent(draft.getDaysAbsent())
                .penalty(Money.zero())
                .extraBonus(Money.zero())
                .deposit(draft.getDeposit())
                .newAdvance(draft.getNewAdvance())
                .grossAmount(draft.getTotalPay())
                .finalAmount(draft.getFinalAmount())
                .build())
            .toList();
        return finalizeSettlement(SettlementKind.SALARY, period, lines, notes);
    }

    /**
     * Snapshots matching the filter, most recently saved first.
     */
    @Transactional(readOnly = true)
    public List<SettlementHistory> listHistory(SettlementFilter filter) {
        LocalDate from = filter.getFrom() != null ? filter.getFrom() : EARLIEST;
        LocalDate to = filter.getTo() != null ? filter.getTo() : LATEST;
        List<SettlementHistoryEntity> entities = filter.getKind() == null
            ? historyRepository.findByPeriodStartGreaterThanEqualAndPeriodEndLessThanEqualOrderBySavedAtDesc(from, to)
            : historyRepository.findByKindAndPeriodStartGreaterThanEqualAndPeriodEndLessThanEqualOrderBySavedAtDesc(
                filter.getKind(), from, to);
        return entities.stream().map(SettlementHistoryEntity::toDomain).toList();
    }

    @Transactional(readOnly = true)
    public SettlementHistory getHistory(UUID settlementId) {
        return historyRepository.findById(settlementId)
            .map(SettlementHistoryEntity::toDomain)
            .orElseThrow(() -> NotFoundException.of("Settlement", settlementId));
    }

    /**
     * Removes the snapshot only. Ledger transactions it posted stay in effect.
     */
    @Transactional
    public void deleteHistory(UUID settlementId) {
        SettlementHistoryEntity entity = historyRepository.findById(settlementId)
            .orElseThrow(() -> NotFoundException.of("Settlement", settlementId));
        historyRepository.delete(entity);
        log.info("Deleted {} settlement snapshot {} for {}..{}; ledger postings are kept",
            entity.getKind(), settlementId, entity.getPeriodStart(), entity.getPeriodEnd());
    }

    /**
     * Validates the lines, attaches directory identity and sorts by worker code, then id.
     * Sorting fixes the order in which worker rows are locked.
     */
    private List<SettlementLine> orderedLines(List<SettlementLine> lines) {
        Set<UUID> seen = new HashSet<>();
        for (SettlementLine line : lines) {
            if (line.getWorkerId() == null) {
                throw new ValidationException("Every settlement line needs a worker ID");
            }
            if (!seen.add(line.getWorkerId())) {
                throw new ValidationException("Worker " + line.getWorkerId() + " appears twice in the settlement");
            }
            Money.requireNonNegative(line.getDeposit(), "Deposit");
            Money.requireNonNegative(line.getNewAdvance(), "New advance");
        }

        Map<UUID, Worker> workers = workerService.getWorkers(seen);
        List<SettlementLine> resolved = new ArrayList<>();
        for (SettlementLine line : lines) {
            Worker worker = workers.get(line.getWorkerId());
            if (worker == null) {
                throw NotFoundException.of("Worker", line.getWorkerId());
            }
            resolved.add(line.toBuilder()
                .workerCode(worker.getCode())
                .workerName(worker.getName())
                .hourlyRate(line.getHourlyRate() != null ? line.getHourlyRate() : worker.getHourlyRate())
                .build());
        }
        resolved.sort(Comparator.comparing(SettlementLine::getWorkerCode)
            .thenComparing(SettlementLine::getWorkerId));
        return resolved;
    }

    private SettlementLine postLine(SettlementKind kind, Period period, SettlementLine line, LocalDate today) {
        BigDecimal deposit = Money.orZero(line.getDeposit());
        BigDecimal newAdvance = Money.orZero(line.getNewAdvance());
        String label = kind.name().toLowerCase() + " settlement " + period;
        try {
            if (deposit.signum() > 0) {
                ledgerService.appendTransaction(line.getWorkerId(), TransactionKind.DEPOSIT, deposit, today,
                    line.getWorkerName() + " deposited " + deposit.toPlainString() + " from " + label);
            }
            if (newAdvance.signum() > 0) {
                ledgerService.appendTransaction(line.getWorkerId(), TransactionKind.ADVANCE, newAdvance, today,
                    "New advance of " + newAdvance.toPlainString() + " with " + label);
            }
        } catch (RuntimeException e) {
            throw new SettlementFailedException(line.getWorkerId(), line.getWorkerCode(), e);
        }

        return line.toBuilder()
            .deposit(deposit)
            .newAdvance(newAdvance)
            .hoursWorked(Money.orZero(line.getHoursWorked()))
            .baseAmount(Money.orZero(line.getBaseAmount()))
            .penalty(Money.orZero(line.getPenalty()))
            .extraBonus(Money.orZero(line.getExtraBonus()))
            .grossAmount(Money.orZero(line.getGrossAmount()))
            .finalAmount(Money.orZero(line.getFinalAmount()))
            .advanceBalanceAtSave(ledgerService.getBalance(line.getWorkerId()))
            .build();
    }

    private SettlementHistory snapshot(UUID id, SettlementKind kind, Period period,
                                       List<SettlementLine> lines, String notes) {
        return SettlementHistory.builder()
            .id(id)
            .kind(kind)
            .period(period)
            .savedAt(Instant.now())
            .notes(notes)
            .lines(List.copyOf(lines))
            .workerCount(lines.size())
            .totalBase(sum(lines, SettlementLine::getBaseAmount))
            .totalHours(sum(lines, SettlementLine::getHoursWorked))
            .totalPenalty(sum(lines, SettlementLine::getPenalty))
            .totalExtraBonus(sum(lines, SettlementLine::getExtraBonus))
            .totalDeposit(sum(lines, SettlementLine::getDeposit))
            .totalNewAdvance(sum(lines, SettlementLine::getNewAdvance))
            .totalFinalAmount(sum(lines, SettlementLine::getFinalAmount))
            .totalAdvanceDue(sum(lines, SettlementLine::getAdvanceBalanceAtSave))
            .build();
    }

    private static BigDecimal sum(List<SettlementLine> lines, Function<SettlementLine, BigDecimal> field) {
        return Money.of(lines.stream().map(field).reduce(BigDecimal.ZERO, BigDecimal::add));
    }
}

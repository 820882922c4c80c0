package com.flagship.wage_ledger.compensation.bonus;

import com.flagship.wage_ledger.attendance.AttendanceService;
import com.flagship.wage_ledger.attendance.AttendanceTotals;
import com.flagship.wage_ledger.common.Money;
import com.flagship.wage_ledger.common.Period;
import com.flagship.wage_ledger.compensation.bonus.BonusCalculator.BonusFigures;
import com.flagship.wage_ledger.config.CompensationProperties;
import com.flagship.wage_ledger.exception.ConflictException;
import com.flagship.wage_ledger.exception.ExceedsEntitlementException;
import com.flagship.wage_ledger.exception.NotFoundException;
import com.flagship.wage_ledger.exception.ValidationException;
import com.flagship.wage_ledger.observability.LedgerMetrics;
import com.flagship.wage_ledger.worker.Worker;
import com.flagship.wage_ledger.worker.WorkerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Computes and maintains bonus drafts.
 *
 * A recompute loads the stored draft for (worker, period) and carries its extra bonus,
 * employee deposit and new advance forward; only attendance-derived figures change.
 * Finalized drafts are frozen and come back from a recompute exactly as stored.
 */
@Service
@Slf4j
public class BonusService {

    private final BonusDraftRepository draftRepository;
    private final WorkerService workerService;
    private final AttendanceService attendanceService;
    private final CompensationProperties properties;
    private final LedgerMetrics metrics;
    private final BonusCalculator calculator;

    public BonusService(BonusDraftRepository draftRepository,
                        WorkerService workerService,
                        AttendanceService attendanceService,
                        CompensationProperties properties,
                        LedgerMetrics metrics) {
        this.draftRepository = draftRepository;
        this.workerService = workerService;
        this.attendanceService = attendanceService;
        this.properties = properties;
        this.metrics = metrics;
        this.calculator = new BonusCalculator(properties.getBonusDays(), properties.getBonusHoursPerDay());
    }

    /**
     * Bonus drafts for every active worker without storing anything.
     *
     * @param deductionPerAbsentDay configured default when null
     * @param thresholdRelative configured default when null
     */
    @Transactional(readOnly = true)
    public List<BonusDraft> computeBonusDraft(Period period, BigDecimal deductionPerAbsentDay,
                                              Boolean thresholdRelative) {
        List<BonusDraft> drafts = new ArrayList<>();
        for (Computation computation : computeAll(period, deductionPerAbsentDay, thresholdRelative)) {
            BonusDraftEntity stored = computation.stored();
            if (stored != null && stored.isFinalized()) {
                drafts.add(stored.toDomain(computation.worker()));
                continue;
            }
            drafts.add(previewOf(computation, period));
        }
        return drafts;
    }

    /**
     * Recomputes and stores the drafts of every active worker for the period.
     *
     * @throws ConflictException if another request created or changed a draft concurrently
     */
    @Transactional
    public List<BonusDraft> computeAndSaveBonusDrafts(Period period, BigDecimal deductionPerAbsentDay,
                                                      Boolean thresholdRelative) {
        List<BonusDraft> drafts = new ArrayList<>();
        int written = 0;
        try {
            for (Computation computation : computeAll(period, deductionPerAbsentDay, thresholdRelative)) {
                BonusDraftEntity entity = computation.stored();
                if (entity != null && entity.isFinalized()) {
                    drafts.add(entity.toDomain(computation.worker()));
                    continue;
                }
                if (entity == null) {
                    entity = BonusDraftEntity.create(computation.worker().getId(), period);
                }
                entity.recompute(computation.worker().getHourlyRate(), computation.totals().getDaysPresent(),
                    computation.totals().getDaysAbsent(), computation.deduction(), computation.figures());
                drafts.add(draftRepository.saveAndFlush(entity).toDomain(computation.worker()));
                written++;
            }
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("Bonus drafts for " + period + " were written concurrently", e);
        }

        metrics.recordBonusDraftsComputed(written);
        log.info("Stored {} bonus drafts for {} ({} frozen)", written, period, drafts.size() - written);
        return drafts;
    }

    /**
     * Adds to the draft's extra bonus and recomputes gross and net.
     */
    @Transactional
    public BonusDraft addExtraBonus(UUID draftId, BigDecimal amount, String notes) {
        BigDecimal extra = Money.requirePositive(amount, "Extra bonus amount");
        BonusDraftEntity entity = findAdjustable(draftId);

        entity.addExtraBonus(extra, noteOr(notes, "Added " + extra.toPlainString() + " extra bonus"));
        log.info("Extra bonus {} on draft {}: gross {}, net {}", extra, draftId,
            entity.getGrossBonus(), entity.getNetBonus());
        return save(entity);
    }

    /**
     * Records money the worker leaves with the employer out of this bonus. The cumulative
     * deposit may not exceed the gross bonus.
     *
     * @throws ExceedsEntitlementException if it would
     */
    @Transactional
    public BonusDraft addEmployeeDeposit(UUID draftId, BigDecimal amount, String notes) {
        BigDecimal deposit = Money.requirePositive(amount, "Deposit amount");
        BonusDraftEntity entity = findAdjustable(draftId);

        BigDecimal cumulative = entity.getEmployeeDeposit().add(deposit);
        if (cumulative.compareTo(entity.getGrossBonus()) > 0) {
            throw new ExceedsEntitlementException(draftId, entity.getGrossBonus(), cumulative);
        }

        entity.addEmployeeDeposit(deposit, noteOr(notes, "Employee deposited " + deposit.toPlainString()));
        log.info("Employee deposit {} on draft {}: net {}", deposit, draftId, entity.getNetBonus());
        return save(entity);
    }

    /**
     * Sets the advance to hand out when the bonus is finalized. Does not change the net bonus.
     */
    @Transactional
    public BonusDraft setNewAdvance(UUID draftId, BigDecimal amount, String notes) {
        if (amount == null) {
            throw new ValidationException("New advance amount is required");
        }
        BigDecimal advance = Money.requireNonNegative(amount, "New advance amount");
        BonusDraftEntity entity = findAdjustable(draftId);

        entity.setNewAdvance(advance, noteOr(notes, "New advance set to " + advance.toPlainString()));
        return save(entity);
    }

    /**
     * Records the payout. The ledger is not touched here; deposits and advances reach
     * the ledger only through settlement.
     *
     * @param amountPaid the net bonus when null
     */
    @Transactional
    public BonusDraft markPaid(UUID draftId, BigDecimal amountPaid) {
        BonusDraftEntity entity = findEntity(draftId);
        if (entity.isPaid()) {
            throw new ConflictException("Bonus draft " + draftId + " is already paid");
        }
        BigDecimal paid = amountPaid != null
            ? Money.requireNonNegative(amountPaid, "Amount paid")
            : entity.getNetBonus();

        entity.markPaid(paid, LocalDate.now());
        log.info("Bonus draft {} paid: {}", draftId, paid);
        return save(entity);
    }

    @Transactional(readOnly = true)
    public List<BonusDraft> listBonusDrafts(Period period) {
        List<BonusDraftEntity> entities =
            draftRepository.findByPeriodStartAndPeriodEnd(period.getStart(), period.getEnd());
        Map<UUID, Worker> workers = workerService.getWorkers(
            entities.stream().map(BonusDraftEntity::getWorkerId).toList());
        return entities.stream()
            .map(entity -> entity.toDomain(workers.get(entity.getWorkerId())))
            .sorted(Comparator.comparing(BonusDraft::getWorkerCode, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(BonusDraft::getWorkerId))
            .toList();
    }

    @Transactional(readOnly = true)
    public BonusDraft getBonusDraft(UUID draftId) {
        BonusDraftEntity entity = findEntity(draftId);
        return entity.toDomain(workerService.getWorker(entity.getWorkerId()));
    }

    @Transactional(readOnly = true)
    public BonusSummary bonusSummary(Period period) {
        List<BonusDraftEntity> drafts =
            draftRepository.findByPeriodStartAndPeriodEnd(period.getStart(), period.getEnd());

        BigDecimal totalNet = Money.zero();
        BigDecimal totalPaid = Money.zero();
        BigDecimal totalPending = Money.zero();
        int workersPaid = 0;
        for (BonusDraftEntity draft : drafts) {
            totalNet = totalNet.add(draft.getNetBonus());
            if (draft.isPaid()) {
                totalPaid = totalPaid.add(Money.orZero(draft.getAmountPaid()));
                workersPaid++;
            } else {
                totalPending = totalPending.add(draft.getNetBonus());
            }
        }

        return BonusSummary.builder()
            .period(period)
            .totalWorkers(drafts.size())
            .totalNetBonus(Money.of(totalNet))
            .totalPaid(Money.of(totalPaid))
            .totalPending(Money.of(totalPending))
            .workersPaid(workersPaid)
            .workersPending(drafts.size() - workersPaid)
            .build();
    }

    /**
     * Freezes every stored draft of the period. Runs inside the settlement transaction
     * that posted them.
     *
     * @throws ValidationException if the period has no drafts
     * @throws ConflictException if they were already finalized
     */
    @Transactional
    public List<BonusDraft> finalizeDrafts(Period period) {
        List<BonusDraftEntity> entities =
            draftRepository.findByPeriodStartAndPeriodEnd(period.getStart(), period.getEnd());
        if (entities.isEmpty()) {
            throw new ValidationException("No bonus drafts stored for " + period);
        }
        if (entities.stream().anyMatch(BonusDraftEntity::isFinalized)) {
            throw new ConflictException("Bonus drafts for " + period + " are already finalized");
        }

        Map<UUID, Worker> workers = workerService.getWorkers(
            entities.stream().map(BonusDraftEntity::getWorkerId).toList());
        List<BonusDraft> finalized = new ArrayList<>();
        for (BonusDraftEntity entity : entities) {
            entity.markFinalized();
            finalized.add(draftRepository.save(entity).toDomain(workers.get(entity.getWorkerId())));
        }
        draftRepository.flush();
        return finalized;
    }

    private List<Computation> computeAll(Period period, BigDecimal deductionPerAbsentDay, Boolean thresholdRelative) {
        BigDecimal deduction = Money.requireNonNegative(
            deductionPerAbsentDay != null ? deductionPerAbsentDay : properties.getDefaultDeductionPerAbsentDay(),
            "Deduction per absent day");
        boolean relative = thresholdRelative != null ? thresholdRelative : properties.isThresholdRelativeByDefault();

        List<Worker> workers = workerService.listActiveWorkers();
        Map<UUID, AttendanceTotals> totals = attendanceService.aggregate(period, null);

        int minAbsent = BonusCalculator.minAbsent(workers.stream()
            .map(worker -> totals.getOrDefault(worker.getId(), AttendanceTotals.empty(worker.getId())).getDaysAbsent())
            .toList());

        List<Computation> computations = new ArrayList<>();
        for (Worker worker : workers) {
            AttendanceTotals workerTotals = totals.getOrDefault(worker.getId(), AttendanceTotals.empty(worker.getId()));
            BonusDraftEntity stored = draftRepository
                .findByWorkerIdAndPeriodStartAndPeriodEnd(worker.getId(), period.getStart(), period.getEnd())
                .orElse(null);

            BigDecimal extra = stored != null ? stored.getExtraBonus() : Money.zero();
            BigDecimal deposit = stored != null ? stored.getEmployeeDeposit() : Money.zero();
            BonusFigures figures = calculator.compute(worker.getHourlyRate(), workerTotals.getDaysAbsent(),
                minAbsent, deduction, relative, extra, deposit);

            computations.add(new Computation(worker, workerTotals, stored, Money.of(deduction), figures));
        }
        log.debug("Bonus computation for {}: {} active workers, minAbsent={}, relative={}",
            period, workers.size(), minAbsent, relative);
        return computations;
    }

    private BonusDraft previewOf(Computation computation, Period period) {
        BonusDraftEntity stored = computation.stored();
        Worker worker = computation.worker();
        BonusFigures figures = computation.figures();
        return BonusDraft.builder()
            .id(stored != null ? stored.getId() : null)
            .workerId(worker.getId())
            .workerCode(worker.getCode())
            .workerName(worker.getName())
            .period(period)
            .hourlyRate(worker.getHourlyRate())
            .baseBonus(figures.getBaseBonus())
            .daysWorked(computation.totals().getDaysPresent())
            .daysAbsent(computation.totals().getDaysAbsent())
            .chargeableAbsences(figures.getChargeableAbsences())
            .deductionPerAbsentDay(computation.deduction())
            .penalty(figures.getPenalty())
            .extraBonus(stored != null ? stored.getExtraBonus() : Money.zero())
            .employeeDeposit(stored != null ? stored.getEmployeeDeposit() : Money.zero())
            .newAdvance(stored != null ? stored.getNewAdvance() : Money.zero())
            .grossBonus(figures.getGrossBonus())
            .netBonus(figures.getNetBonus())
            .paid(stored != null && stored.isPaid())
            .amountPaid(stored != null ? stored.getAmountPaid() : null)
            .paidDate(stored != null ? stored.getPaidDate() : null)
            .finalized(false)
            .notes(stored != null ? stored.getNotes() : null)
            .currentAdvanceBalance(worker.getAdvanceBalance())
            .build();
    }

    private BonusDraftEntity findEntity(UUID draftId) {
        return draftRepository.findById(draftId)
            .orElseThrow(() -> NotFoundException.of("Bonus draft", draftId));
    }

    private BonusDraftEntity findAdjustable(UUID draftId) {
        BonusDraftEntity entity = findEntity(draftId);
        if (entity.isFinalized()) {
            throw new ConflictException("Bonus draft " + draftId + " is finalized and can no longer be adjusted");
        }
        return entity;
    }

    private BonusDraft save(BonusDraftEntity entity) {
        BonusDraftEntity saved = draftRepository.saveAndFlush(entity);
        return saved.toDomain(workerService.getWorker(saved.getWorkerId()));
    }

    private static String noteOr(String notes, String fallback) {
        return notes != null && !notes.isBlank() ? notes.trim() : fallback;
    }

    private record Computation(Worker worker, AttendanceTotals totals, BonusDraftEntity stored,
                               BigDecimal deduction, BonusFigures figures) {
    }
}

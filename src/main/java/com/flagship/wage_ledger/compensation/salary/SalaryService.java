package com.flagship.wage_ledger.compensation.salary;

import com.flagship.wage_ledger.attendance.AttendanceService;
import com.flagship.wage_ledger.attendance.AttendanceTotals;
import com.flagship.wage_ledger.common.Money;
import com.flagship.wage_ledger.common.Period;
import com.flagship.wage_ledger.exception.ValidationException;
import com.flagship.wage_ledger.worker.Worker;
import com.flagship.wage_ledger.worker.WorkerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Salary drafts: attendance pay for the period less the operator-entered deposit.
 * Drafts are decoupled from ledger state; only the current balance is shown for reference.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SalaryService {

    private final WorkerService workerService;
    private final AttendanceService attendanceService;

    /**
     * Salary drafts for every active worker, by worker code.
     *
     * @param adjustments deposit and new advance per worker id; workers without one get zeros
     * @throws ValidationException on a negative adjustment or one naming a worker that is not active
     */
    @Transactional(readOnly = true)
    public List<SalaryDraft> computeSalaryDraft(Period period, Map<UUID, SalaryAdjustment> adjustments) {
        Map<UUID, SalaryAdjustment> given = adjustments != null ? adjustments : Map.of();
        List<Worker> workers = workerService.listActiveWorkers();

        Set<UUID> activeIds = workers.stream().map(Worker::getId).collect(Collectors.toSet());
        for (UUID workerId : given.keySet()) {
            if (!activeIds.contains(workerId)) {
                throw new ValidationException("Salary adjustment names a worker that is not active: " + workerId);
            }
        }

        Map<UUID, AttendanceTotals> totals = attendanceService.aggregate(period, null);

        List<SalaryDraft> drafts = workers.stream()
            .map(worker -> draftFor(worker, period,
                totals.getOrDefault(worker.getId(), AttendanceTotals.empty(worker.getId())),
                given.getOrDefault(worker.getId(), SalaryAdjustment.none())))
            .toList();
        log.debug("Computed {} salary drafts for {}", drafts.size(), period);
        return drafts;
    }

    private SalaryDraft draftFor(Worker worker, Period period, AttendanceTotals totals, SalaryAdjustment adjustment) {
        BigDecimal deposit = Money.requireNonNegative(adjustment.getDeposit(), "Deposit");
        BigDecimal newAdvance = Money.requireNonNegative(adjustment.getNewAdvance(), "New advance");

        return SalaryDraft.builder()
            .workerId(worker.getId())
            .workerCode(worker.getCode())
            .workerName(worker.getName())
            .period(period)
            .hourlyRate(worker.getHourlyRate())
            .totalHours(totals.getTotalHours())
            .totalPay(totals.getTotalPay())
            .daysPresent(totals.getDaysPresent())
            .daysAbsent(totals.getDaysAbsent())
            .daysHalf(totals.getDaysHalf())
            .deposit(deposit)
            .newAdvance(newAdvance)
            .finalAmount(Money.floorAtZero(totals.getTotalPay().subtract(deposit)))
            .currentAdvanceBalance(worker.getAdvanceBalance())
            .build();
    }
}

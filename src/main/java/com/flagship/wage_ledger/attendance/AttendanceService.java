package com.flagship.wage_ledger.attendance;

import com.flagship.wage_ledger.attendance.AttendancePayCalculator.DayPay;
import com.flagship.wage_ledger.common.Money;
import com.flagship.wage_ledger.common.Period;
import com.flagship.wage_ledger.exception.ConflictException;
import com.flagship.wage_ledger.exception.NotFoundException;
import com.flagship.wage_ledger.exception.ValidationException;
import com.flagship.wage_ledger.holiday.HolidayService;
import com.flagship.wage_ledger.worker.Worker;
import com.flagship.wage_ledger.worker.WorkerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Records per-day attendance and aggregates it into period totals.
 *
 * Pay is computed from the worker's current rate when the entry is written, so
 * stored entries keep the rate in force on that day.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AttendanceService {

    private static final LocalDate EARLIEST = LocalDate.of(1900, 1, 1);
    private static final LocalDate LATEST = LocalDate.of(9999, 12, 31);

    private final AttendanceEntryRepository entryRepository;
    private final WorkerService workerService;
    private final HolidayService holidayService;

    /**
     * Creates or replaces the worker's entry for {@code date}.
     *
     * @param status defaults to HOLIDAY on a calendar holiday, PRESENT otherwise
     * @param hoursWorked defaults per status; must be within [0, 24]
     * @throws ConflictException if a concurrent upsert created the entry first
     */
    @Transactional
    public AttendanceEntry upsert(UUID workerId, LocalDate date, AttendanceStatus status,
                                  BigDecimal hoursWorked, String notes) {
        if (workerId == null) {
            throw new ValidationException("Worker ID is required");
        }
        if (date == null) {
            throw new ValidationException("Date is required");
        }
        Worker worker = workerService.getWorker(workerId);

        AttendanceStatus effectiveStatus = status != null
            ? status
            : holidayService.isHoliday(date) ? AttendanceStatus.HOLIDAY : AttendanceStatus.PRESENT;

        DayPay dayPay = AttendancePayCalculator.dayPay(
            effectiveStatus, hoursWorked, worker.getStandardDailyHours(), worker.getHourlyRate());

        AttendanceEntryEntity entity = entryRepository.findByWorkerIdAndDate(workerId, date)
            .map(existing -> {
                existing.record(effectiveStatus, dayPay.getHours(), dayPay.getPay(), notes);
                return existing;
            })
            .orElseGet(() -> AttendanceEntryEntity.create(
                workerId, date, effectiveStatus, dayPay.getHours(), dayPay.getPay(), notes));

        try {
            AttendanceEntry saved = entryRepository.saveAndFlush(entity).toDomain();
            log.info("Attendance {} for worker {} on {}: {}h, pay {}",
                saved.getStatus(), worker.getCode(), date, saved.getHoursWorked(), saved.getTotalPay());
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException(
                String.format("Attendance for worker %s on %s was recorded concurrently", worker.getCode(), date), e);
        }
    }

    /**
     * Period totals keyed by worker, for workers that have entries in the period.
     * Callers should treat a missing worker as {@link AttendanceTotals#empty(UUID)}.
     *
     * @param workerId restricts the totals to one worker when not null
     */
    @Transactional(readOnly = true)
    public Map<UUID, AttendanceTotals> aggregate(Period period, UUID workerId) {
        List<AttendanceEntry> entries = (workerId == null
                ? entryRepository.findByDateBetween(period.getStart(), period.getEnd())
                : entryRepository.findByWorkerIdAndDateBetween(workerId, period.getStart(), period.getEnd()))
            .stream()
            .map(AttendanceEntryEntity::toDomain)
            .toList();

        Set<UUID> workerIds = entries.stream().map(AttendanceEntry::getWorkerId).collect(Collectors.toSet());
        Map<UUID, Worker> workers = workerService.getWorkers(workerIds);

        Map<UUID, List<AttendanceEntry>> byWorker = entries.stream()
            .collect(Collectors.groupingBy(AttendanceEntry::getWorkerId, LinkedHashMap::new, Collectors.toList()));

        Map<UUID, AttendanceTotals> totals = new LinkedHashMap<>();
        byWorker.forEach((id, workerEntries) -> totals.put(id, total(workers.get(id), workerEntries)));
        return totals;
    }

    @Transactional(readOnly = true)
    public AttendanceTotals totalsFor(Period period, UUID workerId) {
        return aggregate(period, workerId).getOrDefault(workerId, AttendanceTotals.empty(workerId));
    }

    /**
     * Entries matching the optional filters, newest day first.
     */
    @Transactional(readOnly = true)
    public List<AttendanceEntry> listEntries(UUID workerId, LocalDate from, LocalDate to) {
        LocalDate lower = from != null ? from : EARLIEST;
        LocalDate upper = to != null ? to : LATEST;
        if (lower.isAfter(upper)) {
            throw new ValidationException("From date must not be after to date");
        }
        List<AttendanceEntryEntity> entities = workerId == null
            ? entryRepository.findByDateBetweenOrderByDateDescCreatedAtDesc(lower, upper)
            : entryRepository.findByWorkerIdAndDateBetweenOrderByDateDescCreatedAtDesc(workerId, lower, upper);
        return entities.stream().map(AttendanceEntryEntity::toDomain).toList();
    }

    @Transactional
    public void deleteEntry(UUID entryId) {
        AttendanceEntryEntity entity = entryRepository.findById(entryId)
            .orElseThrow(() -> NotFoundException.of("Attendance entry", entryId));
        entryRepository.delete(entity);
        log.info("Deleted attendance entry {} ({} on {})", entryId, entity.getStatus(), entity.getDate());
    }

    private AttendanceTotals total(Worker worker, List<AttendanceEntry> entries) {
        BigDecimal hours = Money.zero();
        BigDecimal pay = Money.zero();
        int present = 0;
        int absent = 0;
        int half = 0;

        for (AttendanceEntry entry : entries) {
            DayPay day = AttendancePayCalculator.effectiveDayPay(
                entry, worker.getStandardDailyHours(), worker.getHourlyRate());
            hours = hours.add(day.getHours());
            pay = pay.add(day.getPay());
            switch (entry.getStatus()) {
                case PRESENT, HOLIDAY -> present++;
                case ABSENT -> absent++;
                case HALF_DAY -> half++;
            }
        }

        return AttendanceTotals.builder()
            .workerId(worker.getId())
            .totalHours(hours)
            .totalPay(Money.of(pay))
            .daysPresent(present)
            .daysAbsent(absent)
            .daysHalf(half)
            .entryCount(entries.size())
            .build();
    }
}

package com.flagship.wage_ledger.compensation.bonus;

import com.flagship.wage_ledger.common.Money;
import com.flagship.wage_ledger.common.Period;
import com.flagship.wage_ledger.compensation.bonus.BonusCalculator.BonusFigures;
import com.flagship.wage_ledger.worker.Worker;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Stored bonus draft, one per (worker, period).
 *
 * Operator adjustments (extra bonus, employee deposit, new advance) live only here and are
 * never touched by {@link #recompute}; that is what lets a recompute carry them forward.
 * Optimistic locking guards adjustments racing a recompute.
 */
@Entity
@Table(name = "bonus_drafts",
       uniqueConstraints = @UniqueConstraint(name = "uk_bonus_drafts_worker_period",
                                             columnNames = {"worker_id", "period_start", "period_end"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BonusDraftEntity {

    static final int CURRENT_SCHEMA_VERSION = 1;
    private static final int NOTES_MAX_LENGTH = 4000;

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "worker_id", nullable = false, updatable = false)
    private UUID workerId;

    @Column(name = "period_start", nullable = false, updatable = false)
    private LocalDate periodStart;

    @Column(name = "period_end", nullable = false, updatable = false)
    private LocalDate periodEnd;

    @Column(name = "hourly_rate", nullable = false, precision = 19, scale = 2)
    private BigDecimal hourlyRate;

    @Column(name = "base_bonus", nullable = false, precision = 19, scale = 2)
    private BigDecimal baseBonus;

    @Column(name = "days_worked", nullable = false)
    private int daysWorked;

    @Column(name = "days_absent", nullable = false)
    private int daysAbsent;

    @Column(name = "chargeable_absences", nullable = false)
    private int chargeableAbsences;

    @Column(name = "deduction_per_absent_day", nullable = false, precision = 19, scale = 2)
    private BigDecimal deductionPerAbsentDay;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal penalty;

    @Column(name = "extra_bonus", nullable = false, precision = 19, scale = 2)
    private BigDecimal extraBonus;

    @Column(name = "employee_deposit", nullable = false, precision = 19, scale = 2)
    private BigDecimal employeeDeposit;

    @Column(name = "new_advance", nullable = false, precision = 19, scale = 2)
    private BigDecimal newAdvance;

    @Column(name = "gross_bonus", nullable = false, precision = 19, scale = 2)
    private BigDecimal grossBonus;

    @Column(name = "net_bonus", nullable = false, precision = 19, scale = 2)
    private BigDecimal netBonus;

    @Column(nullable = false)
    private boolean paid;

    @Column(name = "amount_paid", precision = 19, scale = 2)
    private BigDecimal amountPaid;

    @Column(name = "paid_date")
    private LocalDate paidDate;

    @Column(nullable = false)
    private boolean finalized;

    @Column(length = NOTES_MAX_LENGTH)
    private String notes;

    @Column(name = "schema_version", nullable = false)
    private int schemaVersion;

    @Version
    @Column(nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static BonusDraftEntity create(UUID workerId, Period period) {
        BonusDraftEntity entity = new BonusDraftEntity();
        entity.id = UUID.randomUUID();
        entity.workerId = workerId;
        entity.periodStart = period.getStart();
        entity.periodEnd = period.getEnd();
        entity.extraBonus = Money.zero();
        entity.employeeDeposit = Money.zero();
        entity.newAdvance = Money.zero();
        entity.schemaVersion = CURRENT_SCHEMA_VERSION;
        return entity;
    }

    /**
     * Replaces the computed figures. Adjustments, payment state and notes are kept.
     */
    void recompute(BigDecimal hourlyRate, int daysWorked, int daysAbsent,
                   BigDecimal deductionPerAbsentDay, BonusFigures figures) {
        this.hourlyRate = hourlyRate;
        this.daysWorked = daysWorked;
        this.daysAbsent = daysAbsent;
        this.deductionPerAbsentDay = deductionPerAbsentDay;
        this.baseBonus = figures.getBaseBonus();
        this.chargeableAbsences = figures.getChargeableAbsences();
        this.penalty = figures.getPenalty();
        this.grossBonus = figures.getGrossBonus();
        this.netBonus = figures.getNetBonus();
        this.schemaVersion = CURRENT_SCHEMA_VERSION;
    }

    void addExtraBonus(BigDecimal amount, String note) {
        this.extraBonus = this.extraBonus.add(amount);
        this.grossBonus = BonusCalculator.grossBonus(baseBonus, penalty, extraBonus);
        this.netBonus = BonusCalculator.netBonus(grossBonus, employeeDeposit);
        appendNote(note);
    }

    void addEmployeeDeposit(BigDecimal amount, String note) {
        this.employeeDeposit = this.employeeDeposit.add(amount);
        this.netBonus = BonusCalculator.netBonus(grossBonus, employeeDeposit);
        appendNote(note);
    }

    void setNewAdvance(BigDecimal amount, String note) {
        this.newAdvance = amount;
        appendNote(note);
    }

    void markPaid(BigDecimal amountPaid, LocalDate paidDate) {
        this.paid = true;
        this.amountPaid = amountPaid;
        this.paidDate = paidDate;
    }

    void markFinalized() {
        this.finalized = true;
    }

    public Period getPeriod() {
        return Period.of(periodStart, periodEnd);
    }

    private void appendNote(String note) {
        String combined = notes == null || notes.isBlank() ? note : notes + "\n" + note;
        // Oldest lines give way first
        this.notes = combined.length() > NOTES_MAX_LENGTH
            ? combined.substring(combined.length() - NOTES_MAX_LENGTH)
            : combined;
    }

    public BonusDraft toDomain(Worker worker) {
        return BonusDraft.builder()
            .id(id)
            .workerId(workerId)
            .workerCode(worker != null ? worker.getCode() : null)
            .workerName(worker != null ? worker.getName() : null)
            .period(getPeriod())
            .hourlyRate(hourlyRate)
            .baseBonus(baseBonus)
            .daysWorked(daysWorked)
            .daysAbsent(daysAbsent)
            .chargeableAbsences(chargeableAbsences)
            .deductionPerAbsentDay(deductionPerAbsentDay)
            .penalty(penalty)
            .extraBonus(extraBonus)
            .employeeDeposit(employeeDeposit)
            .newAdvance(newAdvance)
            .grossBonus(grossBonus)
            .netBonus(netBonus)
            .paid(paid)
            .amountPaid(amountPaid)
            .paidDate(paidDate)
            .finalized(finalized)
            .notes(notes)
            .currentAdvanceBalance(worker != null ? worker.getAdvanceBalance() : null)
            .build();
    }
}

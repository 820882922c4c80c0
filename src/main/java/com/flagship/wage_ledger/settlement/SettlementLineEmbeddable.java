package com.flagship.wage_ledger.settlement;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SettlementLineEmbeddable {

    @Column(name = "worker_id", nullable = false)
    private UUID workerId;

    @Column(name = "worker_code", nullable = false, length = 64)
    private String workerCode;

    @Column(name = "worker_name", nullable = false, length = 200)
    private String workerName;

    @Column(name = "hourly_rate", nullable = false, precision = 19, scale = 2)
    private BigDecimal hourlyRate;

    @Column(name = "base_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal baseAmount;

    @Column(name = "hours_worked", nullable = false, precision = 19, scale = 2)
    private BigDecimal hoursWorked;

    @Column(name = "days_worked", nullable = false)
    private int daysWorked;

    @Column(name = "days_absent", nullable = false)
    private int daysAbsent;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal penalty;

    @Column(name = "extra_bonus", nullable = false, precision = 19, scale = 2)
    private BigDecimal extraBonus;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal deposit;

    @Column(name = "new_advance", nullable = false, precision = 19, scale = 2)
    private BigDecimal newAdvance;

    @Column(name = "gross_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal grossAmount;

    @Column(name = "final_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal finalAmount;

    @Column(name = "advance_balance_at_save", nullable = false, precision = 19, scale = 2)
    private BigDecimal advanceBalanceAtSave;

    static SettlementLineEmbeddable fromDomain(SettlementLine line) {
        return new SettlementLineEmbeddable(
            line.getWorkerId(),
            line.getWorkerCode(),
            line.getWorkerName(),
            line.getHourlyRate(),
            line.getBaseAmount(),
            line.getHoursWorked(),
            line.getDaysWorked(),
            line.getDaysAbsent(),
            line.getPenalty(),
            line.getExtraBonus(),
            line.getDeposit(),
            line.getNewAdvance(),
            line.getGrossAmount(),
            line.getFinalAmount(),
            line.getAdvanceBalanceAtSave()
        );
    }

    SettlementLine toDomain() {
        return SettlementLine.builder()
            .workerId(workerId)
            .workerCode(workerCode)
            .workerName(workerName)
            .hourlyRate(hourlyRate)
            .baseAmount(baseAmount)
            .hoursWorked(hoursWorked)
            .daysWorked(daysWorked)
            .daysAbsent(daysAbsent)
            .penalty(penalty)
            .extraBonus(extraBonus)
            .deposit(deposit)
            .newAdvance(newAdvance)
            .grossAmount(grossAmount)
            .finalAmount(finalAmount)
            .advanceBalanceAtSave(advanceBalanceAtSave)
            .build();
    }
}

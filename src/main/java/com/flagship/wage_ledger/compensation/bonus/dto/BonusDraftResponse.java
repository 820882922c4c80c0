package com.flagship.wage_ledger.compensation.bonus.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wage_ledger.compensation.bonus.BonusDraft;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class BonusDraftResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("worker_id")
    UUID workerId;

    @JsonProperty("worker_code")
    String workerCode;

    @JsonProperty("worker_name")
    String workerName;

    @JsonProperty("period_start")
    LocalDate periodStart;

    @JsonProperty("period_end")
    LocalDate periodEnd;

    @JsonProperty("hourly_rate")
    BigDecimal hourlyRate;

    @JsonProperty("base_bonus")
    BigDecimal baseBonus;

    @JsonProperty("days_worked")
    int daysWorked;

    @JsonProperty("days_absent")
    int daysAbsent;

    @JsonProperty("chargeable_absences")
    int chargeableAbsences;

    @JsonProperty("deduction_per_absent_day")
    BigDecimal deductionPerAbsentDay;

    @JsonProperty("penalty")
    BigDecimal penalty;

    @JsonProperty("extra_bonus")
    BigDecimal extraBonus;

    @JsonProperty("employee_deposit")
    BigDecimal employeeDeposit;

    @JsonProperty("new_advance")
    BigDecimal newAdvance;

    @JsonProperty("gross_bonus")
    BigDecimal grossBonus;

    @JsonProperty("net_bonus")
    BigDecimal netBonus;

    @JsonProperty("paid")
    boolean paid;

    @JsonProperty("amount_paid")
    BigDecimal amountPaid;

    @JsonProperty("paid_date")
    LocalDate paidDate;

    @JsonProperty("finalized")
    boolean finalized;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("current_advance_balance")
    BigDecimal currentAdvanceBalance;

    public static BonusDraftResponse from(BonusDraft draft) {
        return BonusDraftResponse.builder()
            .id(draft.getId())
            .workerId(draft.getWorkerId())
            .workerCode(draft.getWorkerCode())
            .workerName(draft.getWorkerName())
            .periodStart(draft.getPeriod().getStart())
            .periodEnd(draft.getPeriod().getEnd())
            .hourlyRate(draft.getHourlyRate())
            .baseBonus(draft.getBaseBonus())
            .daysWorked(draft.getDaysWorked())
            .daysAbsent(draft.getDaysAbsent())
            .chargeableAbsences(draft.getChargeableAbsences())
            .deductionPerAbsentDay(draft.getDeductionPerAbsentDay())
            .penalty(draft.getPenalty())
            .extraBonus(draft.getExtraBonus())
            .employeeDeposit(draft.getEmployeeDeposit())
            .newAdvance(draft.getNewAdvance())
            .grossBonus(draft.getGrossBonus())
            .netBonus(draft.getNetBonus())
            .paid(draft.isPaid())
            .amountPaid(draft.getAmountPaid())
            .paidDate(draft.getPaidDate())
            .finalized(draft.isFinalized())
            .notes(draft.getNotes())
            .currentAdvanceBalance(draft.getCurrentAdvanceBalance())
            .build();
    }
}

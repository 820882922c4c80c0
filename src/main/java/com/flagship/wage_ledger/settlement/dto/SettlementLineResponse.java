package com.flagship.wage_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wage_ledger.settlement.SettlementLine;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class SettlementLineResponse {

    @JsonProperty("worker_id")
    UUID workerId;

    @JsonProperty("worker_code")
    String workerCode;

    @JsonProperty("worker_name")
    String workerName;

    @JsonProperty("hourly_rate")
    BigDecimal hourlyRate;

    @JsonProperty("base_amount")
    BigDecimal baseAmount;

    @JsonProperty("hours_worked")
    BigDecimal hoursWorked;

    @JsonProperty("days_worked")
    int daysWorked;

    @JsonProperty("days_absent")
    int daysAbsent;

    @JsonProperty("penalty")
    BigDecimal penalty;

    @JsonProperty("extra_bonus")
    BigDecimal extraBonus;

    @JsonProperty("deposit")
    BigDecimal deposit;

    @JsonProperty("new_advance")
    BigDecimal newAdvance;

    @JsonProperty("gross_amount")
    BigDecimal grossAmount;

    @JsonProperty("final_amount")
    BigDecimal finalAmount;

    @JsonProperty("advance_balance_at_save")
    BigDecimal advanceBalanceAtSave;

    public static SettlementLineResponse from(SettlementLine line) {
        return SettlementLineResponse.builder()
            .workerId(line.getWorkerId())
            .workerCode(line.getWorkerCode())
            .workerName(line.getWorkerName())
            .hourlyRate(line.getHourlyRate())
            .baseAmount(line.getBaseAmount())
            .hoursWorked(line.getHoursWorked())
            .daysWorked(line.getDaysWorked())
            .daysAbsent(line.getDaysAbsent())
            .penalty(line.getPenalty())
            .extraBonus(line.getExtraBonus())
            .deposit(line.getDeposit())
            .newAdvance(line.getNewAdvance())
            .grossAmount(line.getGrossAmount())
            .finalAmount(line.getFinalAmount())
            .advanceBalanceAtSave(line.getAdvanceBalanceAtSave())
            .build();
    }
}

package com.flagship.wage_ledger.compensation.salary.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wage_ledger.compensation.salary.SalaryDraft;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class SalaryDraftResponse {

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

    @JsonProperty("total_hours")
    BigDecimal totalHours;

    @JsonProperty("total_pay")
    BigDecimal totalPay;

    @JsonProperty("days_present")
    int daysPresent;

    @JsonProperty("days_absent")
    int daysAbsent;

    @JsonProperty("days_half")
    int daysHalf;

    @JsonProperty("deposit")
    BigDecimal deposit;

    @JsonProperty("new_advance")
    BigDecimal newAdvance;

    @JsonProperty("final_amount")
    BigDecimal finalAmount;

    @JsonProperty("current_advance_balance")
    BigDecimal currentAdvanceBalance;

    public static SalaryDraftResponse from(SalaryDraft draft) {
        return SalaryDraftResponse.builder()
            .workerId(draft.getWorkerId())
            .workerCode(draft.getWorkerCode())
            .workerName(draft.getWorkerName())
            .periodStart(draft.getPeriod().getStart())
            .periodEnd(draft.getPeriod().getEnd())
            .hourlyRate(draft.getHourlyRate())
            .totalHours(draft.getTotalHours())
            .totalPay(draft.getTotalPay())
            .daysPresent(draft.getDaysPresent())
            .daysAbsent(draft.getDaysAbsent())
            .daysHalf(draft.getDaysHalf())
            .deposit(draft.getDeposit())
            .newAdvance(draft.getNewAdvance())
            .finalAmount(draft.getFinalAmount())
            .currentAdvanceBalance(draft.getCurrentAdvanceBalance())
            .build();
    }
}

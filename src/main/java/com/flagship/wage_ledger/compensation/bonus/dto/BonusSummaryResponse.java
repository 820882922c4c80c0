package com.flagship.wage_ledger.compensation.bonus.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wage_ledger.compensation.bonus.BonusSummary;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class BonusSummaryResponse {

    @JsonProperty("period_start")
    LocalDate periodStart;

    @JsonProperty("period_end")
    LocalDate periodEnd;

    @JsonProperty("total_workers")
    int totalWorkers;

    @JsonProperty("total_net_bonus")
    BigDecimal totalNetBonus;

    @JsonProperty("total_paid")
    BigDecimal totalPaid;

    @JsonProperty("total_pending")
    BigDecimal totalPending;

    @JsonProperty("workers_paid")
    int workersPaid;

    @JsonProperty("workers_pending")
    int workersPending;

    public static BonusSummaryResponse from(BonusSummary summary) {
        return BonusSummaryResponse.builder()
            .periodStart(summary.getPeriod().getStart())
            .periodEnd(summary.getPeriod().getEnd())
            .totalWorkers(summary.getTotalWorkers())
            .totalNetBonus(summary.getTotalNetBonus())
            .totalPaid(summary.getTotalPaid())
            .totalPending(summary.getTotalPending())
            .workersPaid(summary.getWorkersPaid())
            .workersPending(summary.getWorkersPending())
            .build();
    }
}

package com.flagship.wage_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wage_ledger.settlement.SettlementHistory;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class SettlementHistoryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("kind")
    String kind;

    @JsonProperty("period_start")
    LocalDate periodStart;

    @JsonProperty("period_end")
    LocalDate periodEnd;

    @JsonProperty("saved_at")
    Instant savedAt;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("worker_count")
    int workerCount;

    @JsonProperty("total_base")
    BigDecimal totalBase;

    @JsonProperty("total_hours")
    BigDecimal totalHours;

    @JsonProperty("total_penalty")
    BigDecimal totalPenalty;

    @JsonProperty("total_extra_bonus")
    BigDecimal totalExtraBonus;

    @JsonProperty("total_deposit")
    BigDecimal totalDeposit;

    @JsonProperty("total_new_advance")
    BigDecimal totalNewAdvance;

    @JsonProperty("total_final_amount")
    BigDecimal totalFinalAmount;

    @JsonProperty("total_advance_due")
    BigDecimal totalAdvanceDue;

    @JsonProperty("lines")
    List<SettlementLineResponse> lines;

    public static SettlementHistoryResponse from(SettlementHistory history) {
        return SettlementHistoryResponse.builder()
            .id(history.getId())
            .kind(history.getKind().name())
            .periodStart(history.getPeriod().getStart())
            .periodEnd(history.getPeriod().getEnd())
            .savedAt(history.getSavedAt())
            .notes(history.getNotes())
            .workerCount(history.getWorkerCount())
            .totalBase(history.getTotalBase())
            .totalHours(history.getTotalHours())
            .totalPenalty(history.getTotalPenalty())
            .totalExtraBonus(history.getTotalExtraBonus())
            .totalDeposit(history.getTotalDeposit())
            .totalNewAdvance(history.getTotalNewAdvance())
            .totalFinalAmount(history.getTotalFinalAmount())
            .totalAdvanceDue(history.getTotalAdvanceDue())
            .lines(history.getLines().stream().map(SettlementLineResponse::from).toList())
            .build();
    }
}

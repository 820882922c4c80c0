package com.flagship.wage_ledger.worker.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wage_ledger.worker.Worker;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class WorkerResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("code")
    String code;

    @JsonProperty("name")
    String name;

    @JsonProperty("hourly_rate")
    BigDecimal hourlyRate;

    @JsonProperty("standard_daily_hours")
    BigDecimal standardDailyHours;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("advance_balance")
    BigDecimal advanceBalance;

    @JsonProperty("total_advance_taken")
    BigDecimal totalAdvanceTaken;

    @JsonProperty("total_advance_repaid")
    BigDecimal totalAdvanceRepaid;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static WorkerResponse from(Worker worker) {
        return WorkerResponse.builder()
            .id(worker.getId())
            .code(worker.getCode())
            .name(worker.getName())
            .hourlyRate(worker.getHourlyRate())
            .standardDailyHours(worker.getStandardDailyHours())
            .active(worker.isActive())
            .advanceBalance(worker.getAdvanceBalance())
            .totalAdvanceTaken(worker.getTotalAdvanceTaken())
            .totalAdvanceRepaid(worker.getTotalAdvanceRepaid())
            .createdAt(worker.getCreatedAt())
            .updatedAt(worker.getUpdatedAt())
            .build();
    }
}

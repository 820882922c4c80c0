package com.flagship.wage_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wage_ledger.ledger.WorkerBalance;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class WorkerBalanceResponse {

    @JsonProperty("worker_id")
    UUID workerId;

    @JsonProperty("worker_code")
    String workerCode;

    @JsonProperty("worker_name")
    String workerName;

    @JsonProperty("advance_balance")
    BigDecimal advanceBalance;

    @JsonProperty("total_advance_taken")
    BigDecimal totalAdvanceTaken;

    @JsonProperty("total_advance_repaid")
    BigDecimal totalAdvanceRepaid;

    public static WorkerBalanceResponse from(WorkerBalance balance) {
        return WorkerBalanceResponse.builder()
            .workerId(balance.getWorkerId())
            .workerCode(balance.getWorkerCode())
            .workerName(balance.getWorkerName())
            .advanceBalance(balance.getAdvanceBalance())
            .totalAdvanceTaken(balance.getTotalAdvanceTaken())
            .totalAdvanceRepaid(balance.getTotalAdvanceRepaid())
            .build();
    }
}

package com.flagship.wage_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class WorkerLedgerResponse {

    @JsonProperty("worker_id")
    UUID workerId;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("transactions")
    List<LedgerTransactionResponse> transactions;
}

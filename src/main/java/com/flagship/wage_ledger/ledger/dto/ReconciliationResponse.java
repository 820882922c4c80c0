package com.flagship.wage_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wage_ledger.ledger.ReconciliationResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class ReconciliationResponse {

    @JsonProperty("worker_id")
    UUID workerId;

    @JsonProperty("consistent")
    boolean consistent;

    @JsonProperty("cached_balance")
    BigDecimal cachedBalance;

    @JsonProperty("computed_balance")
    BigDecimal computedBalance;

    @JsonProperty("transaction_count")
    int transactionCount;

    @JsonProperty("broken_links")
    List<Long> brokenLinks;

    public static ReconciliationResponse from(ReconciliationResult result) {
        return ReconciliationResponse.builder()
            .workerId(result.getWorkerId())
            .consistent(result.isConsistent())
            .cachedBalance(result.getCachedBalance())
            .computedBalance(result.getComputedBalance())
            .transactionCount(result.getTransactionCount())
            .brokenLinks(result.getBrokenLinks())
            .build();
    }
}

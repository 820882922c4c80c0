package com.flagship.wage_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wage_ledger.ledger.LedgerTransaction;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class LedgerTransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("worker_id")
    UUID workerId;

    @JsonProperty("kind")
    String kind;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("balance_after")
    BigDecimal balanceAfter;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("sequence_number")
    long sequenceNumber;

    @JsonProperty("created_at")
    Instant createdAt;

    public static LedgerTransactionResponse from(LedgerTransaction txn) {
        return LedgerTransactionResponse.builder()
            .id(txn.getId())
            .workerId(txn.getWorkerId())
            .kind(txn.getKind().name())
            .amount(txn.getAmount())
            .date(txn.getDate())
            .balanceAfter(txn.getBalanceAfter())
            .notes(txn.getNotes())
            .sequenceNumber(txn.getSequenceNumber())
            .createdAt(txn.getCreatedAt())
            .build();
    }
}

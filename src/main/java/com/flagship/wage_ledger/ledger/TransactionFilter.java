package com.flagship.wage_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Optional criteria for listing ledger transactions; null fields do not filter.
 */
@Value
@Builder
public class TransactionFilter {
    UUID workerId;
    TransactionKind kind;
    LocalDate from;
    LocalDate to;

    public static TransactionFilter all() {
        return TransactionFilter.builder().build();
    }
}

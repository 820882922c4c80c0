package com.flagship.wage_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Immutable ledger posting.
 *
 * Invariant: balanceAfter = previous balanceAfter (or 0) +/- amount, and never negative.
 */
@Value
public class LedgerTransaction {
    UUID id;
    UUID workerId;
    TransactionKind kind;
    BigDecimal amount;
    LocalDate date;
    BigDecimal balanceAfter;
    String notes;
    long sequenceNumber;
    Instant createdAt;
}

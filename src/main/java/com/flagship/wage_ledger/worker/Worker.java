package com.flagship.wage_ledger.worker;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A worker as seen by the ledger and compensation engine.
 *
 * {@code advanceBalance} is a cache owned by the ledger: it always equals the
 * {@code balanceAfter} of the worker's most recent ledger transaction (0 when none).
 */
@Value
public class Worker {
    UUID id;
    String code;
    String name;
    BigDecimal hourlyRate;
    BigDecimal standardDailyHours;
    boolean active;
    BigDecimal advanceBalance;
    BigDecimal totalAdvanceTaken;
    BigDecimal totalAdvanceRepaid;
    Instant createdAt;
    Instant updatedAt;
}

package com.flagship.wage_ledger.attendance;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One worker's attendance on one calendar day. {@code hoursWorked} and {@code totalPay}
 * are the stored values; aggregation may read a zero-hour holiday as a full day.
 */
@Value
public class AttendanceEntry {
    UUID id;
    UUID workerId;
    LocalDate date;
    AttendanceStatus status;
    BigDecimal hoursWorked;
    BigDecimal totalPay;
    String notes;
    Instant createdAt;
    Instant updatedAt;
}

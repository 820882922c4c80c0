package com.flagship.wage_ledger.settlement;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One worker's row in a settlement. {@code baseAmount} is the base bonus or the attendance
 * pay; {@code finalAmount} is what the worker receives. {@code advanceBalanceAtSave} is the
 * ledger balance right after this line's postings and is filled in by finalize.
 */
@Value
@Builder(toBuilder = true)
public class SettlementLine {
    UUID workerId;
    String workerCode;
    String workerName;
    BigDecimal hourlyRate;
    BigDecimal baseAmount;
    BigDecimal hoursWorked;
    int daysWorked;
    int daysAbsent;
    BigDecimal penalty;
    BigDecimal extraBonus;
    BigDecimal deposit;
    BigDecimal newAdvance;
    BigDecimal grossAmount;
    BigDecimal finalAmount;
    BigDecimal advanceBalanceAtSave;
}

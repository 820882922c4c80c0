package com.flagship.wage_ledger.compensation.bonus;

import com.flagship.wage_ledger.common.Period;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A worker's bonus for a period. {@code id} is null for a preview that was never stored.
 *
 * {@code grossBonus} is what the worker is entitled to; {@code netBonus} is what is
 * handed over after the employee's own deposit towards their advance.
 */
@Value
@Builder(toBuilder = true)
public class BonusDraft {
    UUID id;
    UUID workerId;
    String workerCode;
    String workerName;
    Period period;
    BigDecimal hourlyRate;
    BigDecimal baseBonus;
    int daysWorked;
    int daysAbsent;
    int chargeableAbsences;
    BigDecimal deductionPerAbsentDay;
    BigDecimal penalty;
    BigDecimal extraBonus;
    BigDecimal employeeDeposit;
    BigDecimal newAdvance;
    BigDecimal grossBonus;
    BigDecimal netBonus;
    boolean paid;
    BigDecimal amountPaid;
    LocalDate paidDate;
    boolean finalized;
    String notes;
    BigDecimal currentAdvanceBalance;
}

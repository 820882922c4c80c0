package com.flagship.wage_ledger.compensation.salary;

import com.flagship.wage_ledger.common.Period;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A worker's salary for a period. Computed on demand, never stored.
 *
 * {@code finalAmount = max(0, totalPay − deposit)}; the new advance is paid out
 * separately and is not netted against it.
 */
@Value
@Builder
public class SalaryDraft {
    UUID workerId;
    String workerCode;
    String workerName;
    Period period;
    BigDecimal hourlyRate;
    BigDecimal totalHours;
    BigDecimal totalPay;
    int daysPresent;
    int daysAbsent;
    int daysHalf;
    BigDecimal deposit;
    BigDecimal newAdvance;
    BigDecimal finalAmount;
    BigDecimal currentAdvanceBalance;
}

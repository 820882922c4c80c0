package com.flagship.wage_ledger.attendance;

import com.flagship.wage_ledger.common.Money;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A worker's attendance over a period. {@code daysPresent} counts PRESENT and HOLIDAY
 * entries, {@code daysAbsent} counts ABSENT ones; half days are counted separately.
 */
@Value
@Builder
public class AttendanceTotals {
    UUID workerId;
    BigDecimal totalHours;
    BigDecimal totalPay;
    int daysPresent;
    int daysAbsent;
    int daysHalf;
    int entryCount;

    public static AttendanceTotals empty(UUID workerId) {
        return AttendanceTotals.builder()
            .workerId(workerId)
            .totalHours(Money.zero())
            .totalPay(Money.zero())
            .build();
    }
}

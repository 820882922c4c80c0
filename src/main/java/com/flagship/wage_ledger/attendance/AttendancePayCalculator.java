package com.flagship.wage_ledger.attendance;

import com.flagship.wage_ledger.common.Money;
import com.flagship.wage_ledger.exception.ValidationException;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Pay rules for a single attendance day. Pure; no persistence.
 */
public final class AttendancePayCalculator {

    private static final BigDecimal HALF = new BigDecimal("0.5");
    private static final BigDecimal MAX_HOURS = new BigDecimal("24");

    private AttendancePayCalculator() {
        // Utility class
    }

    @Value
    public static class DayPay {
        BigDecimal hours;
        BigDecimal pay;
    }

    /**
     * Hours and pay to store for a day.
     *
     * PRESENT and HOLIDAY pay the worked hours at the hourly rate (defaulting to the
     * standard day and to zero respectively). HALF_DAY pays half the standard day and
     * ignores supplied hours. ABSENT stores nothing.
     */
    public static DayPay dayPay(AttendanceStatus status, BigDecimal suppliedHours,
                                BigDecimal standardDailyHours, BigDecimal hourlyRate) {
        if (suppliedHours != null
                && (suppliedHours.signum() < 0 || suppliedHours.compareTo(MAX_HOURS) > 0)) {
            throw new ValidationException("Hours worked must be between 0 and 24");
        }

        return switch (status) {
            case ABSENT -> new DayPay(hours(BigDecimal.ZERO), Money.zero());
            case HALF_DAY -> {
                BigDecimal halfDay = standardDailyHours.multiply(HALF);
                yield new DayPay(hours(halfDay), Money.of(halfDay.multiply(hourlyRate)));
            }
            case HOLIDAY -> paid(suppliedHours != null ? suppliedHours : BigDecimal.ZERO, hourlyRate);
            case PRESENT -> paid(suppliedHours != null ? suppliedHours : standardDailyHours, hourlyRate);
        };
    }

    private static DayPay paid(BigDecimal worked, BigDecimal hourlyRate) {
        return new DayPay(hours(worked), Money.of(worked.multiply(hourlyRate)));
    }

    /**
     * Hours and pay an entry contributes to period totals. A holiday recorded with zero
     * hours counts as a paid standard day; every other entry counts as stored.
     */
    public static DayPay effectiveDayPay(AttendanceEntry entry, BigDecimal standardDailyHours,
                                         BigDecimal hourlyRate) {
        if (entry.getStatus() == AttendanceStatus.HOLIDAY && entry.getHoursWorked().signum() == 0) {
            return new DayPay(hours(standardDailyHours), Money.of(standardDailyHours.multiply(hourlyRate)));
        }
        return new DayPay(hours(entry.getHoursWorked()), Money.of(entry.getTotalPay()));
    }

    private static BigDecimal hours(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}

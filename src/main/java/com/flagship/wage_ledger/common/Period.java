package com.flagship.wage_ledger.common;

import com.flagship.wage_ledger.exception.ValidationException;
import lombok.Value;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Inclusive range of calendar days, {@code [start, end]}.
 *
 * Invariant: start and end are present and start is not after end.
 */
@Value
public class Period {
    LocalDate start;
    LocalDate end;

    private Period(LocalDate start, LocalDate end) {
        this.start = start;
        this.end = end;
    }

    public static Period of(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new ValidationException("Period start and end are required");
        }
        if (start.isAfter(end)) {
            throw new ValidationException(
                String.format("Period start %s must not be after end %s", start, end));
        }
        return new Period(start, end);
    }

    /**
     * First day of the start month through the last day of the end month.
     */
    public static Period ofMonths(int startYear, int startMonth, int endYear, int endMonth) {
        if (startMonth < 1 || startMonth > 12 || endMonth < 1 || endMonth > 12) {
            throw new ValidationException("Months must be between 1 and 12");
        }
        return of(YearMonth.of(startYear, startMonth).atDay(1),
                  YearMonth.of(endYear, endMonth).atEndOfMonth());
    }

    public boolean contains(LocalDate day) {
        return !day.isBefore(start) && !day.isAfter(end);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}

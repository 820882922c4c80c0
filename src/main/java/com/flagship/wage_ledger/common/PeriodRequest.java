package com.flagship.wage_ledger.common;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wage_ledger.exception.ValidationException;
import lombok.Value;

import java.time.LocalDate;

/**
 * A period in a request body: either explicit days, or a month range where the period
 * runs from the first day of the start month to the last day of the end month.
 */
@Value
public class PeriodRequest {

    @JsonProperty("period_start")
    LocalDate periodStart;

    @JsonProperty("period_end")
    LocalDate periodEnd;

    @JsonProperty("start_year")
    Integer startYear;

    @JsonProperty("start_month")
    Integer startMonth;

    @JsonProperty("end_year")
    Integer endYear;

    @JsonProperty("end_month")
    Integer endMonth;

    public Period toPeriod() {
        if (periodStart != null || periodEnd != null) {
            return Period.of(periodStart, periodEnd);
        }
        if (startYear == null || startMonth == null || endYear == null || endMonth == null) {
            throw new ValidationException(
                "Either period_start/period_end or start_year/start_month/end_year/end_month is required");
        }
        return Period.ofMonths(startYear, startMonth, endYear, endMonth);
    }
}

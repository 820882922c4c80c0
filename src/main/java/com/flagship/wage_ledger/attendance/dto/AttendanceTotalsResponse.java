package com.flagship.wage_ledger.attendance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wage_ledger.attendance.AttendanceTotals;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class AttendanceTotalsResponse {

    @JsonProperty("worker_id")
    UUID workerId;

    @JsonProperty("total_hours")
    BigDecimal totalHours;

    @JsonProperty("total_pay")
    BigDecimal totalPay;

    @JsonProperty("days_present")
    int daysPresent;

    @JsonProperty("days_absent")
    int daysAbsent;

    @JsonProperty("days_half")
    int daysHalf;

    @JsonProperty("entry_count")
    int entryCount;

    public static AttendanceTotalsResponse from(AttendanceTotals totals) {
        return AttendanceTotalsResponse.builder()
            .workerId(totals.getWorkerId())
            .totalHours(totals.getTotalHours())
            .totalPay(totals.getTotalPay())
            .daysPresent(totals.getDaysPresent())
            .daysAbsent(totals.getDaysAbsent())
            .daysHalf(totals.getDaysHalf())
            .entryCount(totals.getEntryCount())
            .build();
    }
}

package com.flagship.wage_ledger.attendance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wage_ledger.attendance.AttendanceEntry;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class AttendanceEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("worker_id")
    UUID workerId;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("status")
    String status;

    @JsonProperty("hours_worked")
    BigDecimal hoursWorked;

    @JsonProperty("total_pay")
    BigDecimal totalPay;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static AttendanceEntryResponse from(AttendanceEntry entry) {
        return AttendanceEntryResponse.builder()
            .id(entry.getId())
            .workerId(entry.getWorkerId())
            .date(entry.getDate())
            .status(entry.getStatus().name())
            .hoursWorked(entry.getHoursWorked())
            .totalPay(entry.getTotalPay())
            .notes(entry.getNotes())
            .createdAt(entry.getCreatedAt())
            .updatedAt(entry.getUpdatedAt())
            .build();
    }
}

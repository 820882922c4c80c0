package com.flagship.wage_ledger.attendance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wage_ledger.attendance.AttendanceStatus;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class UpsertAttendanceRequest {

    @NotNull(message = "Worker ID is required")
    @JsonProperty("worker_id")
    UUID workerId;

    @NotNull(message = "Date is required")
    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("status")
    AttendanceStatus status;

    @DecimalMin(value = "0", message = "Hours worked must be between 0 and 24")
    @DecimalMax(value = "24", message = "Hours worked must be between 0 and 24")
    @JsonProperty("hours_worked")
    BigDecimal hoursWorked;

    @Size(max = 500, message = "Notes must be at most 500 characters")
    @JsonProperty("notes")
    String notes;
}

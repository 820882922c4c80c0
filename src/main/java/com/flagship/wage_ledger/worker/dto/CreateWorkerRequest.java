package com.flagship.wage_ledger.worker.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class CreateWorkerRequest {

    @NotBlank(message = "Worker code is required")
    @Size(max = 64, message = "Worker code must be at most 64 characters")
    @JsonProperty("code")
    String code;

    @NotBlank(message = "Name is required")
    @Size(max = 200, message = "Name must be at most 200 characters")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Hourly rate is required")
    @DecimalMin(value = "0.01", message = "Hourly rate must be greater than 0")
    @JsonProperty("hourly_rate")
    BigDecimal hourlyRate;

    @DecimalMin(value = "0.5", message = "Standard daily hours must be at least 0.5")
    @JsonProperty("standard_daily_hours")
    BigDecimal standardDailyHours;

    @JsonProperty("active")
    Boolean active;
}

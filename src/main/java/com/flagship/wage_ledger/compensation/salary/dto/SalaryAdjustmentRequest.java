package com.flagship.wage_ledger.compensation.salary.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class SalaryAdjustmentRequest {

    @NotNull(message = "Worker ID is required")
    @JsonProperty("worker_id")
    UUID workerId;

    @DecimalMin(value = "0", message = "Deposit must not be negative")
    @JsonProperty("deposit")
    BigDecimal deposit;

    @DecimalMin(value = "0", message = "New advance must not be negative")
    @JsonProperty("new_advance")
    BigDecimal newAdvance;
}

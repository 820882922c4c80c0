package com.flagship.wage_ledger.compensation.bonus.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wage_ledger.common.PeriodRequest;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class ComputeBonusRequest {

    @NotNull(message = "Period is required")
    @JsonProperty("period")
    PeriodRequest period;

    @DecimalMin(value = "0", message = "Deduction per absent day must not be negative")
    @JsonProperty("deduction_per_absent_day")
    BigDecimal deductionPerAbsentDay;

    @JsonProperty("threshold_relative")
    Boolean thresholdRelative;
}

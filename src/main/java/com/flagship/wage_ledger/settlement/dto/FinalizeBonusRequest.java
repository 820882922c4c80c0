package com.flagship.wage_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wage_ledger.common.PeriodRequest;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class FinalizeBonusRequest {

    @NotNull(message = "Period is required")
    @JsonProperty("period")
    PeriodRequest period;

    @Size(max = 1000, message = "Notes must be at most 1000 characters")
    @JsonProperty("notes")
    String notes;
}

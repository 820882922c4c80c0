package com.flagship.wage_ledger.compensation.bonus.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Extra bonus, employee deposit or new advance on a draft.
 */
@Value
public class DraftAdjustmentRequest {

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @Size(max = 500, message = "Notes must be at most 500 characters")
    @JsonProperty("notes")
    String notes;
}

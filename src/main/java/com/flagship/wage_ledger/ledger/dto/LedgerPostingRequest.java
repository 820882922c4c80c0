package com.flagship.wage_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Body of an advance, repayment or deposit posting. The amount is range-checked by the
 * ledger itself so HTTP and in-process callers get the same error.
 */
@Value
public class LedgerPostingRequest {

    @NotNull(message = "Worker ID is required")
    @JsonProperty("worker_id")
    UUID workerId;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("date")
    LocalDate date;

    @Size(max = 500, message = "Notes must be at most 500 characters")
    @JsonProperty("notes")
    String notes;
}

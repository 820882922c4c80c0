package com.flagship.wage_ledger.compensation.bonus.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class MarkPaidRequest {

    /**
     * Defaults to the draft's net bonus.
     */
    @JsonProperty("amount_paid")
    BigDecimal amountPaid;
}

package com.flagship.wage_ledger.compensation.salary.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wage_ledger.common.Money;
import com.flagship.wage_ledger.common.PeriodRequest;
import com.flagship.wage_ledger.compensation.salary.SalaryAdjustment;
import com.flagship.wage_ledger.exception.ValidationException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Period and per-worker adjustments for a salary preview or finalize.
 */
@Value
public class SalaryDraftRequest {

    @NotNull(message = "Period is required")
    @JsonProperty("period")
    PeriodRequest period;

    @Valid
    @JsonProperty("adjustments")
    List<SalaryAdjustmentRequest> adjustments;

    @Size(max = 1000, message = "Notes must be at most 1000 characters")
    @JsonProperty("notes")
    String notes;

    public Map<UUID, SalaryAdjustment> adjustmentsByWorker() {
        Map<UUID, SalaryAdjustment> byWorker = new LinkedHashMap<>();
        if (adjustments == null) {
            return byWorker;
        }
        for (SalaryAdjustmentRequest adjustment : adjustments) {
            SalaryAdjustment previous = byWorker.put(adjustment.getWorkerId(), new SalaryAdjustment(
                Money.orZero(adjustment.getDeposit()), Money.orZero(adjustment.getNewAdvance())));
            if (previous != null) {
                throw new ValidationException("Duplicate salary adjustment for worker " + adjustment.getWorkerId());
            }
        }
        return byWorker;
    }
}

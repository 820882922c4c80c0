package com.flagship.wage_ledger.compensation.bonus;

import com.flagship.wage_ledger.common.Period;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Payment progress of a period's stored drafts. Pending counts the net bonus of
 * drafts not yet marked paid.
 */
@Value
@Builder
public class BonusSummary {
    Period period;
    int totalWorkers;
    BigDecimal totalNetBonus;
    BigDecimal totalPaid;
    BigDecimal totalPending;
    int workersPaid;
    int workersPending;
}

package com.flagship.wage_ledger.settlement;

import com.flagship.wage_ledger.common.Period;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Immutable snapshot written once per finalize. {@code totalAdvanceDue} sums the
 * balances the workers were left owing.
 */
@Value
@Builder
public class SettlementHistory {
    UUID id;
    SettlementKind kind;
    Period period;
    Instant savedAt;
    String notes;
    List<SettlementLine> lines;
    int workerCount;
    BigDecimal totalBase;
    BigDecimal totalHours;
    BigDecimal totalPenalty;
    BigDecimal totalExtraBonus;
    BigDecimal totalDeposit;
    BigDecimal totalNewAdvance;
    BigDecimal totalFinalAmount;
    BigDecimal totalAdvanceDue;
}

package com.flagship.wage_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of folding a worker's full history against the cached balance.
 * {@code brokenLinks} lists the sequence numbers whose balanceAfter does not follow
 * from the previous posting.
 */
@Value
@Builder
public class ReconciliationResult {
    UUID workerId;
    BigDecimal cachedBalance;
    BigDecimal computedBalance;
    int transactionCount;
    List<Long> brokenLinks;

    public boolean isConsistent() {
        return brokenLinks.isEmpty() && cachedBalance.compareTo(computedBalance) == 0;
    }
}

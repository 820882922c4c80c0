package com.flagship.wage_ledger.exception;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * An employee deposit that would exceed the computed gross bonus of the draft.
 */
@Getter
public class ExceedsEntitlementException extends RuntimeException {

    private final UUID draftId;
    private final BigDecimal entitlement;
    private final BigDecimal requested;

    public ExceedsEntitlementException(UUID draftId, BigDecimal entitlement, BigDecimal requested) {
        super(String.format("Deposit total %s cannot exceed gross bonus %s (draft %s)",
                requested.toPlainString(), entitlement.toPlainString(), draftId));
        this.draftId = draftId;
        this.entitlement = entitlement;
        this.requested = requested;
    }
}

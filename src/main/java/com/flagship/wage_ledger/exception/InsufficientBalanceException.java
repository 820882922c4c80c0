package com.flagship.wage_ledger.exception;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A debit (repayment or deposit) larger than the worker's current advance balance.
 */
@Getter
public class InsufficientBalanceException extends RuntimeException {

    private final UUID workerId;
    private final BigDecimal balance;
    private final BigDecimal requested;

    public InsufficientBalanceException(UUID workerId, BigDecimal balance, BigDecimal requested) {
        super(String.format("Debit of %s exceeds advance balance %s for worker %s",
                requested.toPlainString(), balance.toPlainString(), workerId));
        this.workerId = workerId;
        this.balance = balance;
        this.requested = requested;
    }
}

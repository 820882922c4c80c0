package com.flagship.wage_ledger.ledger;

import java.math.BigDecimal;

/**
 * Ledger transaction kinds. An advance is a credit to the worker's balance (money the
 * worker owes); a repayment or a deposit withheld from pay is a debit.
 */
public enum TransactionKind {
    ADVANCE(1),
    REPAYMENT(-1),
    DEPOSIT(-1);

    private final int sign;

    TransactionKind(int sign) {
        this.sign = sign;
    }

    public boolean isDebit() {
        return sign < 0;
    }

    /**
     * Balance after posting {@code amount} of this kind on top of {@code balance}.
     */
    public BigDecimal apply(BigDecimal balance, BigDecimal amount) {
        return isDebit() ? balance.subtract(amount) : balance.add(amount);
    }
}

package com.flagship.wage_ledger.compensation.salary;

import com.flagship.wage_ledger.common.Money;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Operator-entered figures for one worker's salary: the deposit withheld from pay
 * towards the advance, and a new advance to hand out at finalize.
 */
@Value
public class SalaryAdjustment {
    BigDecimal deposit;
    BigDecimal newAdvance;

    public static SalaryAdjustment none() {
        return new SalaryAdjustment(Money.zero(), Money.zero());
    }
}

package com.flagship.wage_ledger.compensation.bonus;

import com.flagship.wage_ledger.common.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Collection;

/**
 * Bonus arithmetic. Pure: the same inputs always give the same figures.
 *
 * <pre>
 * baseBonus          = bonusDays × hoursPerDay × hourlyRate
 * chargeableAbsences = relative ? max(0, daysAbsent − minAbsent) : daysAbsent
 * penalty            = chargeableAbsences × deductionPerAbsentDay
 * grossBonus         = max(0, baseBonus − penalty + extraBonus)
 * netBonus           = max(0, grossBonus − employeeDeposit)
 * </pre>
 */
public class BonusCalculator {

    private final BigDecimal bonusHours;

    public BonusCalculator(int bonusDays, int hoursPerDay) {
        this.bonusHours = BigDecimal.valueOf((long) bonusDays * hoursPerDay);
    }

    @Value
    public static class BonusFigures {
        BigDecimal baseBonus;
        int chargeableAbsences;
        BigDecimal penalty;
        BigDecimal grossBonus;
        BigDecimal netBonus;
    }

    /**
     * Fewest absences among the given workers; 0 when there are none.
     */
    public static int minAbsent(Collection<Integer> daysAbsent) {
        return daysAbsent.stream().mapToInt(Integer::intValue).min().orElse(0);
    }

    public BonusFigures compute(BigDecimal hourlyRate, int daysAbsent, int minAbsent,
                                BigDecimal deductionPerAbsentDay, boolean thresholdRelative,
                                BigDecimal extraBonus, BigDecimal employeeDeposit) {
        BigDecimal baseBonus = baseBonus(hourlyRate);
        int chargeable = chargeableAbsences(daysAbsent, minAbsent, thresholdRelative);
        BigDecimal penalty = Money.of(deductionPerAbsentDay.multiply(BigDecimal.valueOf(chargeable)));
        BigDecimal gross = grossBonus(baseBonus, penalty, extraBonus);
        return new BonusFigures(baseBonus, chargeable, penalty, gross, netBonus(gross, employeeDeposit));
    }

    public BigDecimal baseBonus(BigDecimal hourlyRate) {
        return Money.of(bonusHours.multiply(hourlyRate));
    }

    public static int chargeableAbsences(int daysAbsent, int minAbsent, boolean thresholdRelative) {
        return thresholdRelative ? Math.max(0, daysAbsent - minAbsent) : daysAbsent;
    }

    public static BigDecimal grossBonus(BigDecimal baseBonus, BigDecimal penalty, BigDecimal extraBonus) {
        return Money.floorAtZero(baseBonus.subtract(penalty).add(extraBonus));
    }

    public static BigDecimal netBonus(BigDecimal grossBonus, BigDecimal employeeDeposit) {
        return Money.floorAtZero(grossBonus.subtract(employeeDeposit));
    }
}

package com.flagship.wage_ledger.common;

import com.flagship.wage_ledger.exception.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Amount helpers. All stored amounts carry two decimal places.
 */
public final class Money {

    public static final int SCALE = 2;

    private Money() {
        // Utility class
    }

    public static BigDecimal of(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(SCALE);
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value == null ? zero() : of(value);
    }

    public static BigDecimal floorAtZero(BigDecimal value) {
        return value.signum() < 0 ? zero() : of(value);
    }

    /**
     * Rejects a missing amount, or one that is zero or negative once rounded to cents.
     */
    public static BigDecimal requirePositive(BigDecimal amount, String field) {
        if (amount == null) {
            throw new ValidationException(field + " must be greater than 0");
        }
        BigDecimal rounded = of(amount);
        if (rounded.signum() <= 0) {
            throw new ValidationException(field + " must be at least 0.01");
        }
        return rounded;
    }

    /**
     * Rejects a negative amount; a missing one reads as zero.
     */
    public static BigDecimal requireNonNegative(BigDecimal amount, String field) {
        if (amount != null && amount.signum() < 0) {
            throw new ValidationException(field + " must not be negative");
        }
        return orZero(amount);
    }
}

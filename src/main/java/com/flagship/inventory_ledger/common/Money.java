package com.flagship.inventory_ledger.common;

import com.flagship.inventory_ledger.common.exception.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Helpers for monetary amounts. All amounts carry exactly two decimal places.
 */
public final class Money {

    public static final int SCALE = 2;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    /**
     * Largest amount a NUMERIC(19, 2) column holds.
     */
    public static final BigDecimal MAX_AMOUNT = new BigDecimal("99999999999999999.99");

    private Money() {
    }

    /**
     * Normalizes a caller-supplied amount to two decimals.
     * Amounts with more precision are rejected rather than silently rounded.
     */
    public static BigDecimal normalize(BigDecimal amount, String field) {
        if (amount == null) {
            throw new ValidationException(field + " is required");
        }
        BigDecimal normalized;
        try {
            normalized = amount.setScale(SCALE, RoundingMode.UNNECESSARY);
        } catch (ArithmeticException e) {
            throw new ValidationException(field + " must have at most " + SCALE + " decimal places");
        }
        return requireStorable(normalized, field);
    }

    public static BigDecimal requireStorable(BigDecimal amount, String field) {
        if (amount.abs().compareTo(MAX_AMOUNT) > 0) {
            throw new ValidationException(field + " exceeds the maximum amount " + MAX_AMOUNT.toPlainString());
        }
        return amount;
    }

    public static BigDecimal requireNonNegative(BigDecimal amount, String field) {
        BigDecimal normalized = normalize(amount, field);
        if (normalized.signum() < 0) {
            throw new ValidationException(field + " cannot be negative");
        }
        return normalized;
    }

    public static BigDecimal requirePositive(BigDecimal amount, String field) {
        BigDecimal normalized = normalize(amount, field);
        if (normalized.signum() <= 0) {
            throw new ValidationException(field + " must be greater than 0");
        }
        return normalized;
    }

    public static BigDecimal times(BigDecimal unit, int quantity) {
        return unit.multiply(BigDecimal.valueOf(quantity)).setScale(SCALE, RoundingMode.UNNECESSARY);
    }

    /**
     * Line total to be stored: {@code unit × quantity}, rejected when it does not fit the column.
     */
    public static BigDecimal total(BigDecimal unit, int quantity, String field) {
        return requireStorable(times(unit, quantity), field);
    }

    public static BigDecimal orZero(BigDecimal amount) {
        return amount == null ? ZERO : amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Share of {@code part} in {@code whole} as a percentage with two decimals; 0 when whole is 0.
     */
    public static BigDecimal percentage(BigDecimal part, BigDecimal whole) {
        if (whole == null || whole.signum() == 0) {
            return ZERO;
        }
        return part.multiply(BigDecimal.valueOf(100)).divide(whole, SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Average of {@code total} over {@code count} with two decimals; 0 when count is 0.
     */
    public static BigDecimal average(BigDecimal total, long count) {
        if (count == 0) {
            return ZERO;
        }
        return total.divide(BigDecimal.valueOf(count), SCALE, RoundingMode.HALF_UP);
    }
}

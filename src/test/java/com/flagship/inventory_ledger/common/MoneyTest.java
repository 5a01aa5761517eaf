package com.flagship.inventory_ledger.common;

import com.flagship.inventory_ledger.common.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class MoneyTest {

    @Test
    @DisplayName("Amounts are normalized to two decimals, extra precision is rejected")
    void normalize() {
        assertEquals(new BigDecimal("150.00"), Money.normalize(new BigDecimal("150"), "price"));
        assertEquals(new BigDecimal("1.50"), Money.normalize(new BigDecimal("1.5"), "price"));
        assertThrows(ValidationException.class, () -> Money.normalize(new BigDecimal("1.005"), "price"));
        assertThrows(ValidationException.class, () -> Money.normalize(null, "price"));
    }

    @Test
    @DisplayName("Sign checks")
    void signs() {
        assertEquals(Money.ZERO, Money.requireNonNegative(BigDecimal.ZERO, "cost"));
        assertThrows(ValidationException.class, () -> Money.requireNonNegative(new BigDecimal("-0.01"), "cost"));
        assertThrows(ValidationException.class, () -> Money.requirePositive(BigDecimal.ZERO, "amount"));
    }

    @Test
    @DisplayName("Line totals are exact")
    void times() {
        assertEquals(new BigDecimal("450.00"), Money.times(new BigDecimal("150.00"), 3));
        assertEquals(new BigDecimal("0.00"), Money.times(new BigDecimal("99.99"), 0));
    }

    @Test
    @DisplayName("Averages and percentages round half up and treat zero as zero")
    void reportArithmetic() {
        assertEquals(new BigDecimal("33.33"), Money.average(new BigDecimal("100.00"), 3));
        assertEquals(Money.ZERO, Money.average(new BigDecimal("100.00"), 0));
        assertEquals(new BigDecimal("66.67"), Money.percentage(new BigDecimal("2"), new BigDecimal("3")));
        assertEquals(Money.ZERO, Money.percentage(new BigDecimal("5"), BigDecimal.ZERO));
        assertEquals(Money.ZERO, Money.orZero(null));
    }

    @Test
    @DisplayName("Amounts and line totals must fit NUMERIC(19, 2)")
    void storableBound() {
        assertEquals(Money.MAX_AMOUNT, Money.normalize(Money.MAX_AMOUNT, "price"));
        assertThrows(ValidationException.class, () -> Money.normalize(new BigDecimal("100000000000000000"), "price"));
        assertThrows(ValidationException.class, () -> Money.total(Money.MAX_AMOUNT, 2, "totalPrice"));
        assertEquals(new BigDecimal("450.00"), Money.total(new BigDecimal("150.00"), 3, "totalPrice"));
    }
}

package com.flagship.inventory_ledger.expense;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * An operating expense. Independent of stock.
 */
@Value
public class Expense {
    UUID id;
    ExpenseCategory category;
    BigDecimal amount;
    String description;
    LocalDate expenseDate;
    ExpensePaymentMethod paymentMethod;
    String receiptNumber;
    UUID createdBy;
    Instant createdAt;
    Instant updatedAt;
}

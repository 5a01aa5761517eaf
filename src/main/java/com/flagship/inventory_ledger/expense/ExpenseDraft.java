package com.flagship.inventory_ledger.expense;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Expense fields supplied by a caller. On create, null date means today and
 * null payment method means cash; on update, null means unchanged.
 */
@Value
@Builder
public class ExpenseDraft {
    ExpenseCategory category;
    BigDecimal amount;
    String description;
    LocalDate expenseDate;
    ExpensePaymentMethod paymentMethod;
    String receiptNumber;
}

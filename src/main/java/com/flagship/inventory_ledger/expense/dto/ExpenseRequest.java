package com.flagship.inventory_ledger.expense.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.expense.ExpenseCategory;
import com.flagship.inventory_ledger.expense.ExpenseDraft;
import com.flagship.inventory_ledger.expense.ExpensePaymentMethod;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Body for creating or updating an expense. Required fields for creation are
 * checked by the service, so the same body serves partial updates.
 */
@Value
public class ExpenseRequest {

    @JsonProperty("category")
    ExpenseCategory category;

    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @Size(max = 500, message = "Description cannot exceed 500 characters")
    @JsonProperty("description")
    String description;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("payment_method")
    ExpensePaymentMethod paymentMethod;

    @Size(max = 100, message = "Receipt number cannot exceed 100 characters")
    @JsonProperty("receipt_number")
    String receiptNumber;

    public ExpenseDraft toDraft() {
        return ExpenseDraft.builder()
            .category(category)
            .amount(amount)
            .description(description)
            .expenseDate(date)
            .paymentMethod(paymentMethod)
            .receiptNumber(receiptNumber)
            .build();
    }
}

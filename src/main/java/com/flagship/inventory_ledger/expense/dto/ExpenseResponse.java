package com.flagship.inventory_ledger.expense.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.expense.Expense;
import com.flagship.inventory_ledger.expense.ExpenseCategory;
import com.flagship.inventory_ledger.expense.ExpensePaymentMethod;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class ExpenseResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("category")
    ExpenseCategory category;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("description")
    String description;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("payment_method")
    ExpensePaymentMethod paymentMethod;

    @JsonProperty("receipt_number")
    String receiptNumber;

    @JsonProperty("created_by")
    UUID createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static ExpenseResponse from(Expense expense) {
        return ExpenseResponse.builder()
            .id(expense.getId())
            .category(expense.getCategory())
            .amount(expense.getAmount())
            .description(expense.getDescription())
            .date(expense.getExpenseDate())
            .paymentMethod(expense.getPaymentMethod())
            .receiptNumber(expense.getReceiptNumber())
            .createdBy(expense.getCreatedBy())
            .createdAt(expense.getCreatedAt())
            .updatedAt(expense.getUpdatedAt())
            .build();
    }
}

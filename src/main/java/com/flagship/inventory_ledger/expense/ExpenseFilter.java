package com.flagship.inventory_ledger.expense;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class ExpenseFilter {
    ExpenseCategory category;
    LocalDate from;
    LocalDate to;
}

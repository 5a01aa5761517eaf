package com.flagship.inventory_ledger.expense;

public enum ExpenseCategory {
    TRANSPORT,
    FOOD,
    MAINTENANCE,
    TAXES,
    OTHER
}

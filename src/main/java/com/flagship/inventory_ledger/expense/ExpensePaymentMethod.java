package com.flagship.inventory_ledger.expense;

public enum ExpensePaymentMethod {
    CASH,
    MOBILE_MONEY,
    BANK_TRANSFER,
    CARD
}

package com.flagship.inventory_ledger.sale;

public enum PaymentMethod {
    CASH,
    MOBILE,
    CARD
}

package com.flagship.inventory_ledger.audit;

public enum AuditAction {
    CREATE_PRODUCT,
    UPDATE_PRODUCT,
    DELETE_PRODUCT,
    ADJUST_STOCK,
    CREATE_SALE,
    UPDATE_SALE,
    UPDATE_SALE_PAYMENT,
    DELETE_SALE,
    CREATE_PURCHASE,
    UPDATE_PURCHASE,
    DELETE_PURCHASE,
    CREATE_EXPENSE,
    UPDATE_EXPENSE,
    DELETE_EXPENSE
}

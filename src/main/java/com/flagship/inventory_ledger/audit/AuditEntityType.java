package com.flagship.inventory_ledger.audit;

public enum AuditEntityType {
    PRODUCT,
    SALE,
    PURCHASE,
    EXPENSE
}

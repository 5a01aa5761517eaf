package com.flagship.inventory_ledger.notification;

public enum NotificationType {
    LOW_STOCK,
    SALE,
    PURCHASE,
    EXPENSE,
    SYSTEM
}

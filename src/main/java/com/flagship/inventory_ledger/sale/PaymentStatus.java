package com.flagship.inventory_ledger.sale;

/**
 * Only PAID sales count as revenue; PENDING sales are reported separately.
 */
public enum PaymentStatus {
    PAID,
    PENDING
}

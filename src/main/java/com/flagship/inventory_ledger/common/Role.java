package com.flagship.inventory_ledger.common;

/**
 * Roles issued by the upstream identity provider.
 */
public enum Role {
    ADMIN,
    SALES,
    STOCK
}

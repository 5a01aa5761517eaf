package com.flagship.inventory_ledger.common;

import java.util.EnumSet;
import java.util.Set;

/**
 * Guarded operations and the roles allowed to perform them.
 */
public enum Permission {
    RECORD_SALES(EnumSet.of(Role.ADMIN, Role.SALES)),
    RECORD_PURCHASES(EnumSet.of(Role.ADMIN, Role.STOCK)),
    MANAGE_PRODUCTS(EnumSet.of(Role.ADMIN, Role.STOCK)),
    MANAGE_EXPENSES(EnumSet.of(Role.ADMIN, Role.SALES)),
    DELETE_EXPENSES(EnumSet.of(Role.ADMIN)),
    READ_AUDIT_LOG(EnumSet.of(Role.ADMIN)),
    BROADCAST_NOTIFICATIONS(EnumSet.of(Role.ADMIN));

    private final Set<Role> allowedRoles;

    Permission(Set<Role> allowedRoles) {
        this.allowedRoles = allowedRoles;
    }

    public boolean isGrantedTo(Role role) {
        return role != null && allowedRoles.contains(role);
    }
}

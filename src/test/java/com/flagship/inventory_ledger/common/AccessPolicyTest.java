package com.flagship.inventory_ledger.common;

import com.flagship.inventory_ledger.common.exception.ForbiddenOperationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class AccessPolicyTest {

    private static Actor actor(Role role) {
        return Actor.of(UUID.randomUUID(), role);
    }

    @ParameterizedTest
    @EnumSource(Permission.class)
    @DisplayName("Admins hold every permission")
    void adminHoldsEverything(Permission permission) {
        assertDoesNotThrow(() -> AccessPolicy.require(actor(Role.ADMIN), permission));
    }

    @Test
    @DisplayName("Sales clerks sell and record expenses but do not buy stock")
    void salesRole() {
        Actor sales = actor(Role.SALES);
        assertDoesNotThrow(() -> AccessPolicy.require(sales, Permission.RECORD_SALES));
        assertDoesNotThrow(() -> AccessPolicy.require(sales, Permission.MANAGE_EXPENSES));
        assertThrows(ForbiddenOperationException.class, () -> AccessPolicy.require(sales, Permission.RECORD_PURCHASES));
        assertThrows(ForbiddenOperationException.class, () -> AccessPolicy.require(sales, Permission.DELETE_EXPENSES));
    }

    @Test
    @DisplayName("Stock keepers buy and manage products but do not sell")
    void stockRole() {
        Actor stock = actor(Role.STOCK);
        assertDoesNotThrow(() -> AccessPolicy.require(stock, Permission.RECORD_PURCHASES));
        assertDoesNotThrow(() -> AccessPolicy.require(stock, Permission.MANAGE_PRODUCTS));
        assertThrows(ForbiddenOperationException.class, () -> AccessPolicy.require(stock, Permission.RECORD_SALES));
        assertThrows(ForbiddenOperationException.class, () -> AccessPolicy.require(stock, Permission.READ_AUDIT_LOG));
    }

    @Test
    @DisplayName("A missing actor is forbidden")
    void missingActor() {
        assertThrows(ForbiddenOperationException.class, () -> AccessPolicy.require(null, Permission.RECORD_SALES));
    }
}

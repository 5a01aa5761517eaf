package com.flagship.inventory_ledger.common;

import lombok.Value;

import java.util.UUID;

/**
 * The already-authenticated caller of an operation.
 * Identity and role are asserted upstream and trusted here.
 */
@Value
public class Actor {
    UUID id;
    Role role;

    public static Actor of(UUID id, Role role) {
        if (id == null) {
            throw new IllegalArgumentException("Actor id cannot be null");
        }
        if (role == null) {
            throw new IllegalArgumentException("Actor role cannot be null");
        }
        return new Actor(id, role);
    }

    public boolean hasRole(Role candidate) {
        return role == candidate;
    }
}

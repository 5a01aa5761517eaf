package com.flagship.inventory_ledger.common;

import com.flagship.inventory_ledger.common.exception.ForbiddenOperationException;

/**
 * Role checks applied by services before any write.
 */
public final class AccessPolicy {

    private AccessPolicy() {
    }

    public static void require(Actor actor, Permission permission) {
        if (actor == null) {
            throw new ForbiddenOperationException("No actor supplied for " + permission);
        }
        if (!permission.isGrantedTo(actor.getRole())) {
            throw new ForbiddenOperationException(
                String.format("Role %s is not allowed to %s", actor.getRole(),
                    permission.name().toLowerCase().replace('_', ' ')));
        }
    }
}

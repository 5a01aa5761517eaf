package com.flagship.inventory_ledger.notification;

import com.flagship.inventory_ledger.common.Role;

import java.util.List;
import java.util.UUID;

/**
 * Computes recipient sets at the moment a notification is fanned out.
 */
public interface RecipientResolver {

    /**
     * Active administrators. Alerts derived from ledger events go here.
     */
    List<UUID> admins();

    List<UUID> withRole(Role role);

    List<UUID> everyone();
}

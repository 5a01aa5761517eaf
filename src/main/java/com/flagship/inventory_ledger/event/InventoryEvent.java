package com.flagship.inventory_ledger.event;

import com.flagship.inventory_ledger.common.Role;

import java.time.Instant;
import java.util.UUID;

/**
 * A committed fact about the ledger, the catalog or expenses.
 *
 * Each event is written to the outbox in the same transaction as the change it
 * describes, and handed to in-process listeners, which act only after commit.
 */
public interface InventoryEvent {

    /**
     * Unique per event instance; lets consumers deduplicate.
     */
    UUID getEventId();

    /**
     * Sale, Purchase, Product or Expense.
     */
    String getAggregateType();

    UUID getAggregateId();

    String getEventType();

    UUID getActorId();

    Role getActorRole();

    Instant getOccurredAt();
}

package com.flagship.inventory_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One signed stock delta in the journal. Immutable once written.
 */
@Value
public class StockMovement {
    UUID id;
    UUID productId;
    MovementType movementType;
    int quantityDelta;
    int stockAfter;
    String referenceType;
    UUID referenceId;
    UUID actorId;
    String note;
    long sequenceNumber;
    Instant createdAt;
}

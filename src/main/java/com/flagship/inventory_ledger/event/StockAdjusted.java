package com.flagship.inventory_ledger.event;

import com.flagship.inventory_ledger.catalog.Product;
import com.flagship.inventory_ledger.common.Actor;
import com.flagship.inventory_ledger.common.Role;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An administrative rewrite of the stock counter, journaled as an adjustment.
 */
@Value
public class StockAdjusted implements StockChangingEvent {
    UUID eventId;
    UUID productId;
    String productName;
    Integer stockBefore;
    Integer stockAfter;
    String reason;
    UUID actorId;
    Role actorRole;
    Instant occurredAt;

    public static final String EVENT_TYPE = "StockAdjusted";

    @Override
    public String getAggregateType() {
        return "Product";
    }

    @Override
    public UUID getAggregateId() {
        return productId;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static StockAdjusted of(Product product, int stockBefore, String reason, Actor actor, Instant occurredAt) {
        return new StockAdjusted(
            UUID.randomUUID(),
            product.getId(),
            product.getName(),
            stockBefore,
            product.getStockQuantity(),
            reason,
            actor.getId(),
            actor.getRole(),
            occurredAt
        );
    }
}

package com.flagship.inventory_ledger.event;

import com.flagship.inventory_ledger.catalog.Product;
import com.flagship.inventory_ledger.common.Actor;
import com.flagship.inventory_ledger.common.Role;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class ProductCreated implements InventoryEvent {
    UUID eventId;
    UUID productId;
    String name;
    String sku;
    String category;
    int openingStock;
    UUID actorId;
    Role actorRole;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ProductCreated";

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

    public static ProductCreated of(Product product, Actor actor, Instant occurredAt) {
        return new ProductCreated(
            UUID.randomUUID(),
            product.getId(),
            product.getName(),
            product.getSku(),
            product.getCategory(),
            product.getStockQuantity(),
            actor.getId(),
            actor.getRole(),
            occurredAt
        );
    }
}

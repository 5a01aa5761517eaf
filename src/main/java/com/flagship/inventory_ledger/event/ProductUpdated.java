package com.flagship.inventory_ledger.event;

import com.flagship.inventory_ledger.catalog.Product;
import com.flagship.inventory_ledger.common.Actor;
import com.flagship.inventory_ledger.common.Role;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Catalog fields of a product changed. A stock rewrite additionally emits
 * {@link StockAdjusted}.
 */
@Value
public class ProductUpdated implements InventoryEvent {
    UUID eventId;
    UUID productId;
    String name;
    String sku;
    List<String> changedFields;
    UUID actorId;
    Role actorRole;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ProductUpdated";

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

    public static ProductUpdated of(Product product, List<String> changedFields, Actor actor, Instant occurredAt) {
        return new ProductUpdated(
            UUID.randomUUID(),
            product.getId(),
            product.getName(),
            product.getSku(),
            List.copyOf(changedFields),
            actor.getId(),
            actor.getRole(),
            occurredAt
        );
    }
}

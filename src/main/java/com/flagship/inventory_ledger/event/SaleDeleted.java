package com.flagship.inventory_ledger.event;

import com.flagship.inventory_ledger.common.Actor;
import com.flagship.inventory_ledger.common.Role;
import com.flagship.inventory_ledger.sale.Sale;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A sale was removed and its quantity returned to stock. When the product had
 * already been deleted, no stock moved and the stock figures are null.
 */
@Value
public class SaleDeleted implements StockChangingEvent {
    UUID eventId;
    UUID saleId;
    UUID productId;
    String productName;
    int quantity;
    BigDecimal totalPrice;
    Integer stockBefore;
    Integer stockAfter;
    UUID actorId;
    Role actorRole;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SaleDeleted";

    @Override
    public String getAggregateType() {
        return "Sale";
    }

    @Override
    public UUID getAggregateId() {
        return saleId;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SaleDeleted of(Sale sale, Integer stockBefore, Integer stockAfter, Actor actor, Instant occurredAt) {
        return new SaleDeleted(
            UUID.randomUUID(),
            sale.getId(),
            sale.getProductId(),
            sale.getProductSnapshot().getName(),
            sale.getQuantitySold(),
            sale.getTotalPrice(),
            stockBefore,
            stockAfter,
            actor.getId(),
            actor.getRole(),
            occurredAt
        );
    }
}

package com.flagship.inventory_ledger.event;

import com.flagship.inventory_ledger.common.Actor;
import com.flagship.inventory_ledger.common.Role;
import com.flagship.inventory_ledger.purchase.Purchase;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class PurchaseDeleted implements StockChangingEvent {
    UUID eventId;
    UUID purchaseId;
    UUID productId;
    String productName;
    int quantity;
    BigDecimal totalCost;
    String supplier;
    Integer stockBefore;
    Integer stockAfter;
    UUID actorId;
    Role actorRole;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PurchaseDeleted";

    @Override
    public String getAggregateType() {
        return "Purchase";
    }

    @Override
    public UUID getAggregateId() {
        return purchaseId;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PurchaseDeleted of(Purchase purchase, Integer stockBefore, Integer stockAfter, Actor actor, Instant occurredAt) {
        return new PurchaseDeleted(
            UUID.randomUUID(),
            purchase.getId(),
            purchase.getProductId(),
            purchase.getProductSnapshot().getName(),
            purchase.getQuantityPurchased(),
            purchase.getTotalCost(),
            purchase.getSupplier(),
            stockBefore,
            stockAfter,
            actor.getId(),
            actor.getRole(),
            occurredAt
        );
    }
}

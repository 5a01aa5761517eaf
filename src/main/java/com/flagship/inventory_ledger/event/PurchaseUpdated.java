package com.flagship.inventory_ledger.event;

import com.flagship.inventory_ledger.common.Actor;
import com.flagship.inventory_ledger.common.Role;
import com.flagship.inventory_ledger.purchase.Purchase;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class PurchaseUpdated implements StockChangingEvent {
    UUID eventId;
    UUID purchaseId;
    UUID productId;
    String productName;
    int previousQuantity;
    int quantity;
    BigDecimal unitCost;
    BigDecimal totalCost;
    String supplier;
    List<String> changedFields;
    Integer stockBefore;
    Integer stockAfter;
    UUID actorId;
    Role actorRole;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PurchaseUpdated";

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

    public static PurchaseUpdated of(Purchase before, Purchase after, List<String> changedFields,
                                     int stockBefore, int stockAfter, Actor actor, Instant occurredAt) {
        return new PurchaseUpdated(
            UUID.randomUUID(),
            after.getId(),
            after.getProductId(),
            after.getProductSnapshot().getName(),
            before.getQuantityPurchased(),
            after.getQuantityPurchased(),
            after.getUnitCost(),
            after.getTotalCost(),
            after.getSupplier(),
            List.copyOf(changedFields),
            stockBefore,
            stockAfter,
            actor.getId(),
            actor.getRole(),
            occurredAt
        );
    }
}

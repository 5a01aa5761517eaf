package com.flagship.inventory_ledger.event;

import com.flagship.inventory_ledger.common.Actor;
import com.flagship.inventory_ledger.common.Role;
import com.flagship.inventory_ledger.purchase.Purchase;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A purchase was recorded, stock incremented and the product's cost price
 * replaced by the purchase's unit cost.
 */
@Value
public class PurchaseRecorded implements StockChangingEvent {
    UUID eventId;
    UUID purchaseId;
    UUID productId;
    String productName;
    String productSku;
    int quantity;
    BigDecimal unitCost;
    BigDecimal totalCost;
    String supplier;
    BigDecimal previousCostPrice;
    Integer stockBefore;
    Integer stockAfter;
    UUID actorId;
    Role actorRole;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PurchaseRecorded";

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

    public static PurchaseRecorded of(Purchase purchase, BigDecimal previousCostPrice,
                                      int stockBefore, int stockAfter, Actor actor, Instant occurredAt) {
        return new PurchaseRecorded(
            UUID.randomUUID(),
            purchase.getId(),
            purchase.getProductId(),
            purchase.getProductSnapshot().getName(),
            purchase.getProductSnapshot().getSku(),
            purchase.getQuantityPurchased(),
            purchase.getUnitCost(),
            purchase.getTotalCost(),
            purchase.getSupplier(),
            previousCostPrice,
            stockBefore,
            stockAfter,
            actor.getId(),
            actor.getRole(),
            occurredAt
        );
    }
}

package com.flagship.inventory_ledger.event;

import com.flagship.inventory_ledger.common.Actor;
import com.flagship.inventory_ledger.common.Role;
import com.flagship.inventory_ledger.sale.PaymentMethod;
import com.flagship.inventory_ledger.sale.PaymentStatus;
import com.flagship.inventory_ledger.sale.Sale;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A sale was edited; its previous stock effect was reversed and the new one applied.
 */
@Value
public class SaleUpdated implements StockChangingEvent {
    UUID eventId;
    UUID saleId;
    UUID productId;
    String productName;
    int previousQuantity;
    int quantity;
    BigDecimal previousTotalPrice;
    BigDecimal unitPrice;
    BigDecimal totalPrice;
    PaymentMethod paymentMethod;
    PaymentStatus paymentStatus;
    List<String> changedFields;
    Integer stockBefore;
    Integer stockAfter;
    UUID actorId;
    Role actorRole;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SaleUpdated";

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

    public static SaleUpdated of(Sale before, Sale after, List<String> changedFields,
                                 int stockBefore, int stockAfter, Actor actor, Instant occurredAt) {
        return new SaleUpdated(
            UUID.randomUUID(),
            after.getId(),
            after.getProductId(),
            after.getProductSnapshot().getName(),
            before.getQuantitySold(),
            after.getQuantitySold(),
            before.getTotalPrice(),
            after.getUnitPrice(),
            after.getTotalPrice(),
            after.getPaymentMethod(),
            after.getPaymentStatus(),
            List.copyOf(changedFields),
            stockBefore,
            stockAfter,
            actor.getId(),
            actor.getRole(),
            occurredAt
        );
    }
}

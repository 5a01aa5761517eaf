package com.flagship.inventory_ledger.event;

import com.flagship.inventory_ledger.common.Actor;
import com.flagship.inventory_ledger.common.Role;
import com.flagship.inventory_ledger.sale.PaymentMethod;
import com.flagship.inventory_ledger.sale.PaymentStatus;
import com.flagship.inventory_ledger.sale.Sale;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A sale was recorded and the product's stock decremented.
 */
@Value
public class SaleRecorded implements StockChangingEvent {
    UUID eventId;
    UUID saleId;
    UUID productId;
    String productName;
    String productSku;
    int quantity;
    BigDecimal unitPrice;
    BigDecimal totalPrice;
    PaymentMethod paymentMethod;
    PaymentStatus paymentStatus;
    Integer stockBefore;
    Integer stockAfter;
    UUID actorId;
    Role actorRole;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SaleRecorded";

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

    public static SaleRecorded of(Sale sale, int stockBefore, int stockAfter, Actor actor, Instant occurredAt) {
        return new SaleRecorded(
            UUID.randomUUID(),
            sale.getId(),
            sale.getProductId(),
            sale.getProductSnapshot().getName(),
            sale.getProductSnapshot().getSku(),
            sale.getQuantitySold(),
            sale.getUnitPrice(),
            sale.getTotalPrice(),
            sale.getPaymentMethod(),
            sale.getPaymentStatus(),
            stockBefore,
            stockAfter,
            actor.getId(),
            actor.getRole(),
            occurredAt
        );
    }
}

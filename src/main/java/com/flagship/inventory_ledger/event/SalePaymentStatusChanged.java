package com.flagship.inventory_ledger.event;

import com.flagship.inventory_ledger.common.Actor;
import com.flagship.inventory_ledger.common.Role;
import com.flagship.inventory_ledger.sale.PaymentStatus;
import com.flagship.inventory_ledger.sale.Sale;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class SalePaymentStatusChanged implements InventoryEvent {
    UUID eventId;
    UUID saleId;
    String productName;
    PaymentStatus previousStatus;
    PaymentStatus paymentStatus;
    BigDecimal totalPrice;
    UUID actorId;
    Role actorRole;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SalePaymentStatusChanged";

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

    public static SalePaymentStatusChanged of(Sale sale, PaymentStatus previousStatus, Actor actor, Instant occurredAt) {
        return new SalePaymentStatusChanged(
            UUID.randomUUID(),
            sale.getId(),
            sale.getProductSnapshot().getName(),
            previousStatus,
            sale.getPaymentStatus(),
            sale.getTotalPrice(),
            actor.getId(),
            actor.getRole(),
            occurredAt
        );
    }
}

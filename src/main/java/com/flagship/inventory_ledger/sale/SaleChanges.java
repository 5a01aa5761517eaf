package com.flagship.inventory_ledger.sale;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Partial sale update; null fields are left unchanged. The product cannot change.
 */
@Value
@Builder
public class SaleChanges {
    Integer quantity;
    BigDecimal unitPrice;
    PaymentMethod paymentMethod;
    PaymentStatus paymentStatus;

    public boolean touchesStock() {
        return quantity != null;
    }

    public boolean isEmpty() {
        return quantity == null && unitPrice == null && paymentMethod == null && paymentStatus == null;
    }
}

package com.flagship.inventory_ledger.purchase;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Partial purchase update; null fields are left unchanged.
 */
@Value
@Builder
public class PurchaseChanges {
    Integer quantity;
    BigDecimal unitCost;
    String supplier;

    public boolean isEmpty() {
        return quantity == null && unitCost == null && supplier == null;
    }
}

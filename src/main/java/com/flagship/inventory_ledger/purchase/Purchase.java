package com.flagship.inventory_ledger.purchase;

import com.flagship.inventory_ledger.catalog.ProductSnapshot;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A recorded stock purchase from a supplier.
 */
@Value
public class Purchase {
    UUID id;
    UUID productId;
    ProductSnapshot productSnapshot;
    int quantityPurchased;
    BigDecimal unitCost;
    BigDecimal totalCost;
    String supplier;
    UUID purchasedBy;
    Instant purchasedAt;
    Instant updatedAt;
}

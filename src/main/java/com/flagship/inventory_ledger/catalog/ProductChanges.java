package com.flagship.inventory_ledger.catalog;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Partial product update. Null fields keep their current value. A non-null
 * stockQuantity is an administrative stock rewrite and is journaled as an
 * adjustment.
 */
@Value
@Builder
public class ProductChanges {
    String name;
    String sku;
    String category;
    String description;
    BigDecimal costPrice;
    BigDecimal sellingPrice;
    Integer stockQuantity;
    Integer reorderLevel;
    String adjustmentReason;
}

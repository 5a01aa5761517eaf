package com.flagship.inventory_ledger.catalog;

import com.flagship.inventory_ledger.common.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Catalog entry together with its authoritative stock counter.
 */
@Value
public class Product {
    UUID id;
    String name;
    String sku;
    String category;
    String description;
    BigDecimal costPrice;
    BigDecimal sellingPrice;
    int stockQuantity;
    int reorderLevel;
    Long version;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Derived on read, never stored.
     */
    public boolean isLowStock() {
        return StockLevels.isLowStock(stockQuantity);
    }

    public StockStatus getStockStatus() {
        return StockLevels.statusOf(stockQuantity);
    }

    /**
     * Value of the stock on hand at cost.
     */
    public BigDecimal getStockValue() {
        return Money.times(costPrice, stockQuantity);
    }

    public ProductSnapshot snapshot() {
        return ProductSnapshot.of(name, sku, sellingPrice);
    }
}

package com.flagship.inventory_ledger.event;

import com.flagship.inventory_ledger.catalog.StockLevels;

import java.util.UUID;

/**
 * An event that moved (or may have moved) a product's stock counter.
 * Stock figures are null when the product no longer exists.
 */
public interface StockChangingEvent extends InventoryEvent {

    UUID getProductId();

    String getProductName();

    Integer getStockBefore();

    Integer getStockAfter();

    default boolean fellIntoLowStock() {
        return getStockBefore() != null && getStockAfter() != null
                && StockLevels.fellIntoLowStock(getStockBefore(), getStockAfter());
    }
}

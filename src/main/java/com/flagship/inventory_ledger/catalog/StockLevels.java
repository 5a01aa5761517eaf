package com.flagship.inventory_ledger.catalog;

/**
 * Stock thresholds. The low-stock threshold is a fixed constant and does not
 * follow a product's stored reorder level.
 */
public final class StockLevels {

    public static final int LOW_STOCK_THRESHOLD = 5;

    private StockLevels() {
    }

    /**
     * True at or under the threshold, including zero.
     */
    public static boolean isLowStock(int stockQuantity) {
        return stockQuantity <= LOW_STOCK_THRESHOLD;
    }

    public static boolean isOutOfStock(int stockQuantity) {
        return stockQuantity == 0;
    }

    /**
     * Exclusive classification used by the stock report: zero is out of stock only.
     */
    public static StockStatus statusOf(int stockQuantity) {
        if (isOutOfStock(stockQuantity)) {
            return StockStatus.OUT_OF_STOCK;
        }
        return isLowStock(stockQuantity) ? StockStatus.LOW_STOCK : StockStatus.IN_STOCK;
    }

    /**
     * Whether a stock change should raise a low-stock alert: the counter went
     * down and landed in (0, threshold].
     */
    public static boolean fellIntoLowStock(int before, int after) {
        return after < before && after > 0 && after <= LOW_STOCK_THRESHOLD;
    }
}

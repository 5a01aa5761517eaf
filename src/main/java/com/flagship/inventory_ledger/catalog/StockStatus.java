package com.flagship.inventory_ledger.catalog;

public enum StockStatus {
    OUT_OF_STOCK("Out of Stock"),
    LOW_STOCK("Low Stock"),
    IN_STOCK("In Stock");

    private final String label;

    StockStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}

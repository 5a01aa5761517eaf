package com.flagship.inventory_ledger.catalog;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StockLevelsTest {

    @Test
    @DisplayName("Threshold is inclusive and zero counts as low")
    void lowStockBoundary() {
        assertTrue(StockLevels.isLowStock(5));
        assertFalse(StockLevels.isLowStock(6));
        assertTrue(StockLevels.isLowStock(0));
    }

    @Test
    @DisplayName("Status classification is exclusive")
    void statusOf() {
        assertEquals(StockStatus.OUT_OF_STOCK, StockLevels.statusOf(0));
        assertEquals(StockStatus.LOW_STOCK, StockLevels.statusOf(1));
        assertEquals(StockStatus.LOW_STOCK, StockLevels.statusOf(5));
        assertEquals(StockStatus.IN_STOCK, StockLevels.statusOf(6));
    }

    @Test
    @DisplayName("Alert fires only when stock drops into (0, 5]")
    void fellIntoLowStock() {
        assertTrue(StockLevels.fellIntoLowStock(7, 5));
        assertTrue(StockLevels.fellIntoLowStock(3, 1));
        assertFalse(StockLevels.fellIntoLowStock(7, 6));
        assertFalse(StockLevels.fellIntoLowStock(3, 0));
        assertFalse(StockLevels.fellIntoLowStock(2, 4));
        assertFalse(StockLevels.fellIntoLowStock(4, 4));
    }
}

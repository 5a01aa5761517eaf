package com.flagship.inventory_ledger.common.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Raised when a requested stock decrease exceeds what is on hand.
 * Carries both figures so callers can show "available vs requested".
 */
@Getter
public class InsufficientStockException extends InventoryException {

    private final UUID productId;
    private final int available;
    private final int requested;

    public InsufficientStockException(UUID productId, int available, int requested) {
        super(String.format("Insufficient stock. Available: %d, Requested: %d", available, requested));
        this.productId = productId;
        this.available = available;
        this.requested = requested;
    }

    @Override
    public String getErrorCode() {
        return "Insufficient Stock";
    }
}

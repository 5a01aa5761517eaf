package com.flagship.inventory_ledger.common.exception;

/**
 * Base class of every typed failure raised by the inventory services.
 * Whenever one of these escapes an atomic scope, the stock counter is unchanged.
 */
public abstract class InventoryException extends RuntimeException {

    protected InventoryException(String message) {
        super(message);
    }

    protected InventoryException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short, stable error name rendered in API error bodies.
     */
    public abstract String getErrorCode();
}

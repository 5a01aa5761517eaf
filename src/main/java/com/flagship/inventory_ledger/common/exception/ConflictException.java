package com.flagship.inventory_ledger.common.exception;

public class ConflictException extends InventoryException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "Conflict";
    }
}

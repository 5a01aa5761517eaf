package com.flagship.inventory_ledger.common.exception;

public class ValidationException extends InventoryException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "Validation Failed";
    }
}

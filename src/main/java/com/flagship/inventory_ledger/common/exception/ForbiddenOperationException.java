package com.flagship.inventory_ledger.common.exception;

public class ForbiddenOperationException extends InventoryException {

    public ForbiddenOperationException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "Forbidden";
    }
}

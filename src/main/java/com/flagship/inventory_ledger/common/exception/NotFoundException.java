package com.flagship.inventory_ledger.common.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class NotFoundException extends InventoryException {

    private final String entityType;
    private final UUID entityId;

    public NotFoundException(String entityType, UUID entityId) {
        super(entityType + " not found: " + entityId);
        this.entityType = entityType;
        this.entityId = entityId;
    }

    @Override
    public String getErrorCode() {
        return "Not Found";
    }
}

package com.flagship.inventory_ledger.ledger;

/**
 * Kind of a stock movement and the kind of row it references.
 */
public enum MovementType {
    SALE("SALE"),
    SALE_CORRECTION("SALE"),
    SALE_REVERSAL("SALE"),
    PURCHASE("PURCHASE"),
    PURCHASE_CORRECTION("PURCHASE"),
    PURCHASE_REVERSAL("PURCHASE"),
    ADJUSTMENT("PRODUCT");

    private final String referenceType;

    MovementType(String referenceType) {
        this.referenceType = referenceType;
    }

    public String getReferenceType() {
        return referenceType;
    }
}

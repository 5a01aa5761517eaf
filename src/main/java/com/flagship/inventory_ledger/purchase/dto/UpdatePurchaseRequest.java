package com.flagship.inventory_ledger.purchase.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.purchase.PurchaseChanges;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class UpdatePurchaseRequest {

    @Min(value = 1, message = "Quantity must be at least 1")
    @JsonProperty("quantity")
    Integer quantity;

    @DecimalMin(value = "0.00", message = "Unit cost cannot be negative")
    @JsonProperty("unit_cost")
    BigDecimal unitCost;

    @Size(max = 255, message = "Supplier cannot exceed 255 characters")
    @JsonProperty("supplier")
    String supplier;

    public PurchaseChanges toChanges() {
        return PurchaseChanges.builder()
            .quantity(quantity)
            .unitCost(unitCost)
            .supplier(supplier)
            .build();
    }
}

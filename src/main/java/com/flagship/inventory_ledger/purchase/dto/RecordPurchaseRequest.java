package com.flagship.inventory_ledger.purchase.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class RecordPurchaseRequest {

    @NotNull(message = "Product ID is required")
    @JsonProperty("product_id")
    UUID productId;

    @NotNull(message = "Quantity is required")
    @Min(value = 1, message = "Quantity must be at least 1")
    @JsonProperty("quantity")
    Integer quantity;

    @NotNull(message = "Unit cost is required")
    @DecimalMin(value = "0.00", message = "Unit cost cannot be negative")
    @JsonProperty("unit_cost")
    BigDecimal unitCost;

    @NotBlank(message = "Supplier is required")
    @Size(max = 255, message = "Supplier cannot exceed 255 characters")
    @JsonProperty("supplier")
    String supplier;
}

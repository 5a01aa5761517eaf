package com.flagship.inventory_ledger.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.catalog.ProductChanges;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Partial product update. A stock_quantity here is an administrative stock
 * rewrite; adjustment_reason is kept on the journal row.
 */
@Value
public class UpdateProductRequest {

    @Size(max = 255, message = "Name cannot exceed 255 characters")
    @JsonProperty("name")
    String name;

    @Size(max = 100, message = "SKU cannot exceed 100 characters")
    @JsonProperty("sku")
    String sku;

    @Size(max = 100, message = "Category cannot exceed 100 characters")
    @JsonProperty("category")
    String category;

    @JsonProperty("description")
    String description;

    @DecimalMin(value = "0.00", message = "Cost price cannot be negative")
    @JsonProperty("cost_price")
    BigDecimal costPrice;

    @DecimalMin(value = "0.00", message = "Selling price cannot be negative")
    @JsonProperty("selling_price")
    BigDecimal sellingPrice;

    @Min(value = 0, message = "Stock quantity cannot be negative")
    @JsonProperty("stock_quantity")
    Integer stockQuantity;

    @Min(value = 0, message = "Reorder level cannot be negative")
    @JsonProperty("reorder_level")
    Integer reorderLevel;

    @Size(max = 500, message = "Adjustment reason cannot exceed 500 characters")
    @JsonProperty("adjustment_reason")
    String adjustmentReason;

    public ProductChanges toChanges() {
        return ProductChanges.builder()
            .name(name)
            .sku(sku)
            .category(category)
            .description(description)
            .costPrice(costPrice)
            .sellingPrice(sellingPrice)
            .stockQuantity(stockQuantity)
            .reorderLevel(reorderLevel)
            .adjustmentReason(adjustmentReason)
            .build();
    }
}

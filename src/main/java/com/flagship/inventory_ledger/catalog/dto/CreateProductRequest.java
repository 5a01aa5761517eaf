package com.flagship.inventory_ledger.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.catalog.NewProduct;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class CreateProductRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 255, message = "Name cannot exceed 255 characters")
    @JsonProperty("name")
    String name;

    @NotBlank(message = "SKU is required")
    @Size(max = 100, message = "SKU cannot exceed 100 characters")
    @JsonProperty("sku")
    String sku;

    @NotBlank(message = "Category is required")
    @Size(max = 100, message = "Category cannot exceed 100 characters")
    @JsonProperty("category")
    String category;

    @JsonProperty("description")
    String description;

    @NotNull(message = "Cost price is required")
    @DecimalMin(value = "0.00", message = "Cost price cannot be negative")
    @JsonProperty("cost_price")
    BigDecimal costPrice;

    @NotNull(message = "Selling price is required")
    @DecimalMin(value = "0.00", message = "Selling price cannot be negative")
    @JsonProperty("selling_price")
    BigDecimal sellingPrice;

    @Min(value = 0, message = "Stock quantity cannot be negative")
    @JsonProperty("stock_quantity")
    Integer stockQuantity;

    @Min(value = 0, message = "Reorder level cannot be negative")
    @JsonProperty("reorder_level")
    Integer reorderLevel;

    public NewProduct toNewProduct() {
        return NewProduct.builder()
            .name(name)
            .sku(sku)
            .category(category)
            .description(description)
            .costPrice(costPrice)
            .sellingPrice(sellingPrice)
            .openingStock(stockQuantity)
            .reorderLevel(reorderLevel)
            .build();
    }
}

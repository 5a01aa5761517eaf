package com.flagship.inventory_ledger.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.catalog.Product;
import com.flagship.inventory_ledger.catalog.StockStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ProductResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("sku")
    String sku;

    @JsonProperty("category")
    String category;

    @JsonProperty("description")
    String description;

    @JsonProperty("cost_price")
    BigDecimal costPrice;

    @JsonProperty("selling_price")
    BigDecimal sellingPrice;

    @JsonProperty("stock_quantity")
    int stockQuantity;

    @JsonProperty("reorder_level")
    int reorderLevel;

    @JsonProperty("is_low_stock")
    boolean lowStock;

    @JsonProperty("stock_status")
    StockStatus stockStatus;

    @JsonProperty("stock_value")
    BigDecimal stockValue;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static ProductResponse from(Product product) {
        return ProductResponse.builder()
            .id(product.getId())
            .name(product.getName())
            .sku(product.getSku())
            .category(product.getCategory())
            .description(product.getDescription())
            .costPrice(product.getCostPrice())
            .sellingPrice(product.getSellingPrice())
            .stockQuantity(product.getStockQuantity())
            .reorderLevel(product.getReorderLevel())
            .lowStock(product.isLowStock())
            .stockStatus(product.getStockStatus())
            .stockValue(product.getStockValue())
            .createdAt(product.getCreatedAt())
            .updatedAt(product.getUpdatedAt())
            .build();
    }
}

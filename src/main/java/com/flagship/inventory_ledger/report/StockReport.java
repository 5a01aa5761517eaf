package com.flagship.inventory_ledger.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.catalog.StockStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Current stock position. Low-stock rows are those in (0, 5]; out-of-stock
 * rows are exactly zero and appear only in that subset.
 */
@Value
@Builder
public class StockReport {

    public static final List<String> TABLE_COLUMNS = List.of("Product Name", "SKU", "Category", "Unit Price",
            "Cost Price", "Stock Quantity", "Stock Value", "Status");

    @JsonProperty("totals")
    Totals totals;

    @JsonProperty("categories")
    List<CategoryRollup> categories;

    @JsonProperty("low_stock_products")
    List<ProductLine> lowStockProducts;

    @JsonProperty("out_of_stock_products")
    List<ProductLine> outOfStockProducts;

    @JsonProperty("products")
    List<ProductLine> products;

    public ReportTable toTable() {
        return ReportTable.of(TABLE_COLUMNS, products.stream()
            .map(p -> List.of(p.getName(), p.getSku(), p.getCategory(),
                    p.getUnitPrice().toPlainString(), p.getCostPrice().toPlainString(),
                    String.valueOf(p.getStockQuantity()), p.getStockValue().toPlainString(),
                    p.getStatus().getLabel()))
            .toList());
    }

    @Value
    public static class Totals {
        @JsonProperty("total_stock_value")
        BigDecimal totalStockValue;
        @JsonProperty("total_products")
        long totalProducts;
        // At or under the threshold, zero included
        @JsonProperty("low_stock_count")
        long lowStockCount;
        @JsonProperty("out_of_stock_count")
        long outOfStockCount;
    }

    @Value
    public static class CategoryRollup {
        @JsonProperty("category")
        String category;
        @JsonProperty("count")
        long count;
        @JsonProperty("stock_quantity")
        long stockQuantity;
        @JsonProperty("value")
        BigDecimal value;
    }

    @Value
    public static class ProductLine {
        @JsonProperty("id")
        UUID id;
        @JsonProperty("name")
        String name;
        @JsonProperty("sku")
        String sku;
        @JsonProperty("category")
        String category;
        @JsonProperty("unit_price")
        BigDecimal unitPrice;
        @JsonProperty("cost_price")
        BigDecimal costPrice;
        @JsonProperty("stock_quantity")
        int stockQuantity;
        @JsonProperty("stock_value")
        BigDecimal stockValue;
        @JsonProperty("is_low_stock")
        boolean lowStock;
        @JsonProperty("status")
        StockStatus status;
    }
}

package com.flagship.inventory_ledger.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class PurchasesReport {

    public static final List<String> TABLE_COLUMNS = List.of("Period", "Total Cost", "Purchases", "Items Purchased");

    @JsonProperty("group_by")
    GroupBy groupBy;

    @JsonProperty("totals")
    Totals totals;

    @JsonProperty("timeline")
    List<Period> timeline;

    @JsonProperty("top_suppliers")
    List<SupplierSpend> topSuppliers;

    @JsonProperty("top_products")
    List<TopProduct> topProducts;

    public ReportTable toTable() {
        return ReportTable.of(TABLE_COLUMNS, timeline.stream()
            .map(p -> List.of(p.getPeriod(), p.getSpend().toPlainString(),
                    String.valueOf(p.getPurchases()), String.valueOf(p.getQuantity())))
            .toList());
    }

    @Value
    public static class Totals {
        @JsonProperty("spend")
        BigDecimal spend;
        @JsonProperty("purchases")
        long purchases;
        @JsonProperty("quantity")
        long quantity;
        @JsonProperty("average_purchase_value")
        BigDecimal averagePurchaseValue;
    }

    @Value
    public static class Period {
        @JsonProperty("period")
        String period;
        @JsonProperty("spend")
        BigDecimal spend;
        @JsonProperty("purchases")
        long purchases;
        @JsonProperty("quantity")
        long quantity;
    }

    @Value
    public static class SupplierSpend {
        @JsonProperty("supplier")
        String supplier;
        @JsonProperty("spend")
        BigDecimal spend;
        @JsonProperty("purchases")
        long purchases;
        @JsonProperty("quantity")
        long quantity;
    }

    @Value
    public static class TopProduct {
        @JsonProperty("product_id")
        UUID productId;
        @JsonProperty("name")
        String name;
        @JsonProperty("sku")
        String sku;
        @JsonProperty("quantity")
        long quantity;
        @JsonProperty("spend")
        BigDecimal spend;
        @JsonProperty("purchases")
        long purchases;
    }
}

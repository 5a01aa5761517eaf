package com.flagship.inventory_ledger.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.sale.PaymentMethod;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Sales over a date range. Revenue figures count paid sales only; pending
 * sales are reported separately.
 */
@Value
@Builder
public class SalesReport {

    public static final List<String> TABLE_COLUMNS = List.of("Period", "Revenue", "Orders", "Items Sold");

    @JsonProperty("group_by")
    GroupBy groupBy;

    @JsonProperty("totals")
    Totals totals;

    @JsonProperty("timeline")
    List<Period> timeline;

    @JsonProperty("top_products")
    List<TopProduct> topProducts;

    @JsonProperty("payment_methods")
    List<PaymentMethodShare> paymentMethods;

    public ReportTable toTable() {
        return ReportTable.of(TABLE_COLUMNS, timeline.stream()
            .map(p -> List.of(p.getPeriod(), p.getRevenue().toPlainString(),
                    String.valueOf(p.getOrders()), String.valueOf(p.getQuantity())))
            .toList());
    }

    @Value
    public static class Totals {
        @JsonProperty("revenue")
        BigDecimal revenue;
        @JsonProperty("orders")
        long orders;
        @JsonProperty("quantity")
        long quantity;
        @JsonProperty("pending_revenue")
        BigDecimal pendingRevenue;
        @JsonProperty("pending_orders")
        long pendingOrders;
        @JsonProperty("average_order_value")
        BigDecimal averageOrderValue;
    }

    @Value
    public static class Period {
        @JsonProperty("period")
        String period;
        @JsonProperty("revenue")
        BigDecimal revenue;
        @JsonProperty("orders")
        long orders;
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
        @JsonProperty("revenue")
        BigDecimal revenue;
        @JsonProperty("orders")
        long orders;
    }

    @Value
    public static class PaymentMethodShare {
        @JsonProperty("method")
        PaymentMethod method;
        @JsonProperty("count")
        long count;
        @JsonProperty("total")
        BigDecimal total;
    }
}

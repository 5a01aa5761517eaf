package com.flagship.inventory_ledger.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Today at a glance. "Today" is the calendar day in the organization zone.
 */
@Value
@Builder
public class DashboardSummary {

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("today_revenue")
    BigDecimal todayRevenue;

    @JsonProperty("today_orders")
    long todayOrders;

    @JsonProperty("top_product_today")
    TopProductToday topProductToday;

    @JsonProperty("low_stock_count")
    long lowStockCount;

    @JsonProperty("pending_payments")
    long pendingPayments;

    // 30 days ending today, one point per day, zero-filled
    @JsonProperty("revenue_series")
    List<DailyRevenue> revenueSeries;

    @Value
    public static class TopProductToday {
        @JsonProperty("product_id")
        UUID productId;
        @JsonProperty("name")
        String name;
        @JsonProperty("sku")
        String sku;
        @JsonProperty("quantity")
        long quantity;
    }

    @Value
    public static class DailyRevenue {
        @JsonProperty("date")
        LocalDate date;
        @JsonProperty("revenue")
        BigDecimal revenue;
    }
}

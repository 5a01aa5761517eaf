package com.flagship.inventory_ledger.report;

import com.flagship.inventory_ledger.IntegrationTestSupport;
import com.flagship.inventory_ledger.catalog.Product;
import com.flagship.inventory_ledger.common.DateRange;
import com.flagship.inventory_ledger.expense.ExpenseCategory;
import com.flagship.inventory_ledger.ledger.TransactionRecorder;
import com.flagship.inventory_ledger.sale.PaymentMethod;
import com.flagship.inventory_ledger.sale.PaymentStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Report aggregation over fixture rows. Historical rows are inserted directly
 * so their timestamps can sit on day and week boundaries in the organization
 * zone (Africa/Dar_es_Salaam, UTC+3).
 */
class ReportingEngineTest extends IntegrationTestSupport {

    @Autowired
    private ReportingEngine reportingEngine;

    @Autowired
    private TransactionRecorder transactionRecorder;

    @Autowired
    private ZoneId organizationZone;

    private UUID insertSale(UUID productId, String name, String sku, int quantity, String unitPrice,
                            PaymentStatus status, PaymentMethod method, Instant soldAt) {
        UUID id = UUID.randomUUID();
        BigDecimal price = new BigDecimal(unitPrice);
        Timestamp at = Timestamp.from(soldAt);
        jdbcTemplate.update(
            "INSERT INTO sales (id, product_id, product_name, product_sku, product_price, quantity_sold, " +
            "unit_price, total_price, payment_method, payment_status, sold_by, sold_at, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            id, productId, name, sku, price, quantity, price, price.multiply(BigDecimal.valueOf(quantity)),
            method.name(), status.name(), salesClerk.getId(), at, at, at);
        return id;
    }

    private void insertPurchase(UUID productId, String sku, int quantity, String unitCost, String supplier,
                                Instant purchasedAt) {
        BigDecimal cost = new BigDecimal(unitCost);
        Timestamp at = Timestamp.from(purchasedAt);
        jdbcTemplate.update(
            "INSERT INTO purchases (id, product_id, product_name, product_sku, product_price, quantity_purchased, " +
            "unit_cost, total_cost, supplier, purchased_by, purchased_at, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            UUID.randomUUID(), productId, "Product " + sku, sku, cost, quantity, cost,
            cost.multiply(BigDecimal.valueOf(quantity)), supplier, stockKeeper.getId(), at, at, at);
    }

    private UUID insertExpense(ExpenseCategory category, String amount, LocalDate date) {
        UUID id = UUID.randomUUID();
        Timestamp now = Timestamp.from(Instant.now());
        jdbcTemplate.update(
            "INSERT INTO expenses (id, category, amount, description, expense_date, payment_method, " +
            "created_by, created_at, updated_at) VALUES (?, ?, ?, ?, ?, 'CASH', ?, ?, ?)",
            id, category.name(), new BigDecimal(amount), category.name().toLowerCase() + " " + amount, date,
            admin.getId(), now, now);
        return id;
    }

    private static BigDecimal money(String value) {
        return new BigDecimal(value).setScale(2);
    }

    @Nested
    @DisplayName("Sales report")
    class Sales {

        @Test
        @DisplayName("Days are cut at local midnight, not UTC midnight")
        void dailyBucketsUseOrganizationZone() {
            UUID productId = UUID.randomUUID();
            // 23:00 local on 31 March
            insertSale(productId, "Rice", "RICE", 1, "100", PaymentStatus.PAID, PaymentMethod.CASH,
                    Instant.parse("2024-03-31T20:00:00Z"));
            // 01:30 local on 1 April, still 31 March in UTC
            insertSale(productId, "Rice", "RICE", 2, "100", PaymentStatus.PAID, PaymentMethod.CASH,
                    Instant.parse("2024-03-31T22:30:00Z"));

            SalesReport report = reportingEngine.getSalesReport(
                    DateRange.of(LocalDate.of(2024, 3, 31), LocalDate.of(2024, 4, 1)), GroupBy.DAY);

            assertEquals(List.of("2024-03-31", "2024-04-01"),
                    report.getTimeline().stream().map(SalesReport.Period::getPeriod).toList());
            assertEquals(money("100"), report.getTimeline().get(0).getRevenue());
            assertEquals(money("200"), report.getTimeline().get(1).getRevenue());

            SalesReport aprilOnly = reportingEngine.getSalesReport(
                    DateRange.of(LocalDate.of(2024, 4, 1), LocalDate.of(2024, 4, 1)), GroupBy.MONTH);
            assertEquals(1, aprilOnly.getTotals().getOrders());
            assertEquals("2024-04", aprilOnly.getTimeline().get(0).getPeriod());
        }

        @Test
        @DisplayName("Weeks are ISO weeks, so 3 Jan 2021 belongs to 2020-W53")
        void weeklyBucketsAreIso() {
            UUID productId = UUID.randomUUID();
            insertSale(productId, "Tea", "TEA", 1, "10", PaymentStatus.PAID, PaymentMethod.CASH,
                    Instant.parse("2021-01-03T09:00:00Z"));
            insertSale(productId, "Tea", "TEA", 1, "10", PaymentStatus.PAID, PaymentMethod.CASH,
                    Instant.parse("2021-01-04T09:00:00Z"));

            SalesReport report = reportingEngine.getSalesReport(DateRange.unbounded(), GroupBy.WEEK);

            assertEquals(List.of("2020-W53", "2021-W01"),
                    report.getTimeline().stream().map(SalesReport.Period::getPeriod).toList());
        }

        @Test
        @DisplayName("Pending sales are kept out of revenue and reported on their own")
        void pendingSalesSeparated() {
            UUID productId = UUID.randomUUID();
            Instant at = Instant.parse("2024-05-10T09:00:00Z");
            insertSale(productId, "Oil", "OIL", 2, "150", PaymentStatus.PAID, PaymentMethod.CASH, at);
            insertSale(productId, "Oil", "OIL", 1, "150", PaymentStatus.PAID, PaymentMethod.MOBILE, at);
            insertSale(productId, "Oil", "OIL", 4, "150", PaymentStatus.PENDING, PaymentMethod.CARD, at);

            SalesReport report = reportingEngine.getSalesReport(DateRange.unbounded(), GroupBy.DAY);

            SalesReport.Totals totals = report.getTotals();
            assertEquals(money("450"), totals.getRevenue());
            assertEquals(2, totals.getOrders());
            assertEquals(3, totals.getQuantity());
            assertEquals(money("600"), totals.getPendingRevenue());
            assertEquals(1, totals.getPendingOrders());
            assertEquals(money("225"), totals.getAverageOrderValue());
            assertEquals(2, report.getPaymentMethods().size());
            assertTrue(report.getPaymentMethods().stream().noneMatch(m -> m.getMethod() == PaymentMethod.CARD));
        }

        @Test
        @DisplayName("Top products rank by revenue and use the latest snapshot name")
        void topProducts() {
            UUID cheap = UUID.randomUUID();
            UUID dear = UUID.randomUUID();
            insertSale(cheap, "Salt", "SALT", 10, "5", PaymentStatus.PAID, PaymentMethod.CASH,
                    Instant.parse("2024-06-01T09:00:00Z"));
            insertSale(dear, "Old Name", "SUGAR", 1, "300", PaymentStatus.PAID, PaymentMethod.CASH,
                    Instant.parse("2024-06-01T09:00:00Z"));
            insertSale(dear, "Sugar 1kg", "SUGAR", 1, "300", PaymentStatus.PAID, PaymentMethod.CASH,
                    Instant.parse("2024-06-02T09:00:00Z"));

            List<SalesReport.TopProduct> top = reportingEngine.getSalesReport(DateRange.unbounded(), GroupBy.DAY)
                    .getTopProducts();

            assertEquals(dear, top.get(0).getProductId());
            assertEquals("Sugar 1kg", top.get(0).getName());
            assertEquals(money("600"), top.get(0).getRevenue());
            assertEquals(cheap, top.get(1).getProductId());
        }

        @Test
        @DisplayName("An empty range gives zero totals and no periods")
        void emptyRange() {
            SalesReport report = reportingEngine.getSalesReport(
                    DateRange.of(LocalDate.of(2030, 1, 1), LocalDate.of(2030, 1, 31)), GroupBy.DAY);

            assertEquals(money("0"), report.getTotals().getRevenue());
            assertEquals(money("0"), report.getTotals().getAverageOrderValue());
            assertTrue(report.getTimeline().isEmpty());
            assertEquals(SalesReport.TABLE_COLUMNS, report.toTable().getColumns());
        }
    }

    @Nested
    @DisplayName("Purchases report")
    class Purchases {

        @Test
        @DisplayName("Suppliers rank by spend and products by quantity")
        void supplierAndProductRanking() {
            UUID flour = UUID.randomUUID();
            UUID beans = UUID.randomUUID();
            Instant at = Instant.parse("2024-07-15T08:00:00Z");
            insertPurchase(flour, "FLOUR", 20, "50", "Acme", at);
            insertPurchase(beans, "BEANS", 5, "400", "Globex", at);
            insertPurchase(flour, "FLOUR", 10, "50", "Globex", at);

            PurchasesReport report = reportingEngine.getPurchasesReport(DateRange.unbounded(), GroupBy.MONTH);

            assertEquals(money("3500"), report.getTotals().getSpend());
            assertEquals(3, report.getTotals().getPurchases());
            assertEquals("Globex", report.getTopSuppliers().get(0).getSupplier());
            assertEquals(money("2500"), report.getTopSuppliers().get(0).getSpend());
            assertEquals(flour, report.getTopProducts().get(0).getProductId());
            assertEquals(30, report.getTopProducts().get(0).getQuantity());
            assertEquals(List.of("2024-07"),
                    report.getTimeline().stream().map(PurchasesReport.Period::getPeriod).toList());
        }
    }

    @Nested
    @DisplayName("Stock report")
    class Stock {

        @Test
        @DisplayName("5 is low, 6 is fine, 0 appears only as out of stock")
        void lowStockBoundaries() {
            Product five = createProduct("STK-5", 5, "10", "20");
            Product six = createProduct("STK-6", 6, "10", "20");
            Product zero = createProduct("STK-0", 0, "10", "20");
            Product two = createProduct("STK-2", 2, "10", "20");

            StockReport report = reportingEngine.getStockReport();

            assertEquals(List.of(two.getId(), five.getId()),
                    report.getLowStockProducts().stream().map(StockReport.ProductLine::getId).toList());
            assertEquals(List.of(zero.getId()),
                    report.getOutOfStockProducts().stream().map(StockReport.ProductLine::getId).toList());
            assertTrue(report.getProducts().stream().anyMatch(p -> p.getId().equals(six.getId())));
            assertEquals(4, report.getTotals().getTotalProducts());
            assertEquals(3, report.getTotals().getLowStockCount());
            assertEquals(1, report.getTotals().getOutOfStockCount());
            assertEquals(money("130"), report.getTotals().getTotalStockValue());

            StockReport.CategoryRollup general = report.getCategories().get(0);
            assertEquals("General", general.getCategory());
            assertEquals(4, general.getCount());
            assertEquals(13, general.getStockQuantity());
        }

        @Test
        @DisplayName("Flattened rows carry the status label")
        void tableRows() {
            createProduct("TBL-0", 0, "10", "20");

            ReportTable table = reportingEngine.getStockReport().toTable();

            assertEquals(StockReport.TABLE_COLUMNS, table.getColumns());
            assertEquals("Out of Stock", table.getRows().get(0).get(7));
        }
    }

    @Nested
    @DisplayName("Expenses report")
    class Expenses {

        @Test
        @DisplayName("Category shares add up and the top list is capped at five")
        void categoriesAndTopExpenses() {
            LocalDate day = LocalDate.of(2024, 2, 10);
            insertExpense(ExpenseCategory.TRANSPORT, "300", day);
            insertExpense(ExpenseCategory.TRANSPORT, "100", day);
            insertExpense(ExpenseCategory.FOOD, "400", day);
            insertExpense(ExpenseCategory.TAXES, "200", day.plusDays(1));
            insertExpense(ExpenseCategory.OTHER, "50", day.plusDays(2));
            insertExpense(ExpenseCategory.OTHER, "25", day.plusDays(3));

            ExpensesReport report = reportingEngine.getExpensesReport(
                    DateRange.of(day, day.plusDays(3)), GroupBy.DAY);

            assertEquals(money("1075"), report.getTotals().getAmount());
            assertEquals(6, report.getTotals().getCount());
            assertEquals(4, report.getTimeline().size());

            ExpensesReport.CategoryShare first = report.getCategories().get(0);
            assertEquals(money("400"), first.getTotal());
            assertEquals(new BigDecimal("37.21"), first.getPercentage());

            assertEquals(ReportingEngine.TOP_EXPENSES_LIMIT, report.getTopExpenses().size());
            assertEquals(money("400"), report.getTopExpenses().get(0).getAmount());
        }

        @Test
        @DisplayName("Monthly trend covers six months ending this month, zero-filled")
        void monthlyTrend() {
            YearMonth current = YearMonth.now(organizationZone);
            insertExpense(ExpenseCategory.FOOD, "80", current.atDay(1));
            insertExpense(ExpenseCategory.FOOD, "20", current.minusMonths(2).atDay(1));
            insertExpense(ExpenseCategory.FOOD, "999", current.minusMonths(6).atDay(1));

            List<ExpensesReport.Period> trend = reportingEngine.getExpensesReport(DateRange.unbounded(), GroupBy.MONTH)
                    .getMonthlyTrend();

            assertEquals(ReportingEngine.EXPENSE_TREND_MONTHS, trend.size());
            assertEquals(GroupBy.MONTH.label(current.minusMonths(5).atDay(1)), trend.get(0).getPeriod());
            assertEquals(GroupBy.MONTH.label(current.atDay(1)), trend.get(5).getPeriod());
            assertEquals(money("80"), trend.get(5).getAmount());
            assertEquals(money("20"), trend.get(3).getAmount());
            assertEquals(money("0"), trend.get(4).getAmount());
        }
    }

    @Nested
    @DisplayName("Dashboard")
    class Dashboard {

        @Test
        @DisplayName("Today's paid revenue, top product, pending count and a 30-day series")
        void summary() {
            Product product = createProduct("DASH-1", 20, "10", "25");
            createProduct("DASH-LOW", 2, "10", "25");
            transactionRecorder.createSale(product.getId(), 4, new BigDecimal("25"),
                    PaymentMethod.CASH, PaymentStatus.PAID, salesClerk);
            transactionRecorder.createSale(product.getId(), 2, new BigDecimal("25"),
                    PaymentMethod.CASH, PaymentStatus.PENDING, salesClerk);

            DashboardSummary summary = reportingEngine.getDashboardSummary();

            assertEquals(LocalDate.now(organizationZone), summary.getDate());
            assertEquals(money("100"), summary.getTodayRevenue());
            assertEquals(1, summary.getTodayOrders());
            assertEquals(product.getId(), summary.getTopProductToday().getProductId());
            assertEquals(6, summary.getTopProductToday().getQuantity());
            assertEquals(1, summary.getPendingPayments());
            assertEquals(1, summary.getLowStockCount());

            List<DashboardSummary.DailyRevenue> series = summary.getRevenueSeries();
            assertEquals(ReportingEngine.DASHBOARD_DAYS, series.size());
            assertEquals(summary.getDate(), series.get(series.size() - 1).getDate());
            assertEquals(money("100"), series.get(series.size() - 1).getRevenue());
            assertEquals(money("0"), series.get(0).getRevenue());
        }

        @Test
        @DisplayName("No sales today means no top product")
        void quietDay() {
            DashboardSummary summary = reportingEngine.getDashboardSummary();

            assertNull(summary.getTopProductToday());
            assertEquals(money("0"), summary.getTodayRevenue());
        }
    }
}

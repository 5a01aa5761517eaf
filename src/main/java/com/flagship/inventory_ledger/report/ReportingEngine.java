package com.flagship.inventory_ledger.report;

import com.flagship.inventory_ledger.catalog.StockLevels;
import com.flagship.inventory_ledger.catalog.StockStatus;
import com.flagship.inventory_ledger.common.DateRange;
import com.flagship.inventory_ledger.common.Money;
import com.flagship.inventory_ledger.expense.ExpenseCategory;
import com.flagship.inventory_ledger.sale.PaymentMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read-only aggregation over committed sales, purchases, expenses and
 * products.
 *
 * Grouping happens in Postgres: timestamps are shifted into the organization
 * zone before {@code to_char} labels them, so a day, ISO week or month starts
 * at local midnight. Sums are exact NUMERIC and leave here with two decimals.
 * Nothing in this class writes or takes row locks.
 */
@Service
@Slf4j
@Transactional(readOnly = true)
public class ReportingEngine {

    static final int TOP_PRODUCTS_LIMIT = 10;
    static final int TOP_SUPPLIERS_LIMIT = 10;
    static final int TOP_EXPENSES_LIMIT = 5;
    static final int DASHBOARD_DAYS = 30;
    static final int EXPENSE_TREND_MONTHS = 6;

    private final JdbcTemplate jdbcTemplate;
    private final ZoneId organizationZone;
    private final Clock clock;

    public ReportingEngine(JdbcTemplate jdbcTemplate, ZoneId organizationZone, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.organizationZone = organizationZone;
        this.clock = clock;
    }

    // ==================== Sales ====================

    public SalesReport getSalesReport(DateRange range, GroupBy groupBy) {
        DateRange effective = range != null ? range : DateRange.unbounded();
        GroupBy grouping = groupBy != null ? groupBy : GroupBy.DAY;
        TimeWindow window = TimeWindow.of("sold_at", effective, organizationZone);

        Object[] paidArgs = window.args("PAID");
        SalesReport.Totals totals = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(total_price), 0) AS revenue, COUNT(*) AS orders, " +
            "COALESCE(SUM(quantity_sold), 0) AS quantity " +
            "FROM sales WHERE payment_status = ?" + window.sql(),
            (rs, rowNum) -> {
                BigDecimal revenue = Money.orZero(rs.getBigDecimal("revenue"));
                long orders = rs.getLong("orders");
                return new SalesReport.Totals(revenue, orders, rs.getLong("quantity"),
                        null, 0, Money.average(revenue, orders));
            },
            paidArgs);

        Map<String, Object> pending = jdbcTemplate.queryForMap(
            "SELECT COALESCE(SUM(total_price), 0) AS revenue, COUNT(*) AS orders " +
            "FROM sales WHERE payment_status = ?" + window.sql(),
            window.args("PENDING"));
        totals = new SalesReport.Totals(totals.getRevenue(), totals.getOrders(), totals.getQuantity(),
                Money.orZero((BigDecimal) pending.get("revenue")), ((Number) pending.get("orders")).longValue(),
                totals.getAverageOrderValue());

        List<SalesReport.Period> timeline = jdbcTemplate.query(
            "SELECT to_char(sold_at AT TIME ZONE CAST(? AS text), '" + grouping.postgresPattern() + "') AS period, " +
            "SUM(total_price) AS revenue, COUNT(*) AS orders, SUM(quantity_sold) AS quantity " +
            "FROM sales WHERE payment_status = ?" + window.sql() +
            " GROUP BY 1 ORDER BY 1",
            (rs, rowNum) -> new SalesReport.Period(rs.getString("period"),
                    Money.orZero(rs.getBigDecimal("revenue")), rs.getLong("orders"), rs.getLong("quantity")),
            prepend(organizationZone.getId(), paidArgs));

        List<SalesReport.TopProduct> topProducts = jdbcTemplate.query(
            "SELECT product_id, " +
            "(ARRAY_AGG(product_name ORDER BY sold_at DESC))[1] AS name, " +
            "(ARRAY_AGG(product_sku ORDER BY sold_at DESC))[1] AS sku, " +
            "SUM(quantity_sold) AS quantity, SUM(total_price) AS revenue, COUNT(*) AS orders " +
            "FROM sales WHERE payment_status = ?" + window.sql() +
            " GROUP BY product_id ORDER BY revenue DESC, quantity DESC, product_id LIMIT " + TOP_PRODUCTS_LIMIT,
            (rs, rowNum) -> new SalesReport.TopProduct(rs.getObject("product_id", UUID.class),
                    rs.getString("name"), rs.getString("sku"), rs.getLong("quantity"),
                    Money.orZero(rs.getBigDecimal("revenue")), rs.getLong("orders")),
            paidArgs);

        List<SalesReport.PaymentMethodShare> paymentMethods = jdbcTemplate.query(
            "SELECT payment_method, COUNT(*) AS count, SUM(total_price) AS total " +
            "FROM sales WHERE payment_status = ?" + window.sql() +
            " GROUP BY payment_method ORDER BY total DESC, payment_method",
            (rs, rowNum) -> new SalesReport.PaymentMethodShare(PaymentMethod.valueOf(rs.getString("payment_method")),
                    rs.getLong("count"), Money.orZero(rs.getBigDecimal("total"))),
            paidArgs);

        log.debug("Sales report built: range={}, groupBy={}, periods={}", effective, grouping, timeline.size());
        return SalesReport.builder()
            .groupBy(grouping)
            .totals(totals)
            .timeline(timeline)
            .topProducts(topProducts)
            .paymentMethods(paymentMethods)
            .build();
    }

    // ==================== Purchases ====================

    public PurchasesReport getPurchasesReport(DateRange range, GroupBy groupBy) {
        DateRange effective = range != null ? range : DateRange.unbounded();
        GroupBy grouping = groupBy != null ? groupBy : GroupBy.DAY;
        TimeWindow window = TimeWindow.of("purchased_at", effective, organizationZone);
        Object[] args = window.args();

        PurchasesReport.Totals totals = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(total_cost), 0) AS spend, COUNT(*) AS purchases, " +
            "COALESCE(SUM(quantity_purchased), 0) AS quantity " +
            "FROM purchases WHERE TRUE" + window.sql(),
            (rs, rowNum) -> {
                BigDecimal spend = Money.orZero(rs.getBigDecimal("spend"));
                long purchases = rs.getLong("purchases");
                return new PurchasesReport.Totals(spend, purchases, rs.getLong("quantity"),
                        Money.average(spend, purchases));
            },
            args);

        List<PurchasesReport.Period> timeline = jdbcTemplate.query(
            "SELECT to_char(purchased_at AT TIME ZONE CAST(? AS text), '" + grouping.postgresPattern() + "') AS period, " +
            "SUM(total_cost) AS spend, COUNT(*) AS purchases, SUM(quantity_purchased) AS quantity " +
            "FROM purchases WHERE TRUE" + window.sql() +
            " GROUP BY 1 ORDER BY 1",
            (rs, rowNum) -> new PurchasesReport.Period(rs.getString("period"),
                    Money.orZero(rs.getBigDecimal("spend")), rs.getLong("purchases"), rs.getLong("quantity")),
            prepend(organizationZone.getId(), args));

        List<PurchasesReport.SupplierSpend> suppliers = jdbcTemplate.query(
            "SELECT supplier, SUM(total_cost) AS spend, COUNT(*) AS purchases, SUM(quantity_purchased) AS quantity " +
            "FROM purchases WHERE TRUE" + window.sql() +
            " GROUP BY supplier ORDER BY spend DESC, supplier LIMIT " + TOP_SUPPLIERS_LIMIT,
            (rs, rowNum) -> new PurchasesReport.SupplierSpend(rs.getString("supplier"),
                    Money.orZero(rs.getBigDecimal("spend")), rs.getLong("purchases"), rs.getLong("quantity")),
            args);

        List<PurchasesReport.TopProduct> topProducts = jdbcTemplate.query(
            "SELECT product_id, " +
            "(ARRAY_AGG(product_name ORDER BY purchased_at DESC))[1] AS name, " +
            "(ARRAY_AGG(product_sku ORDER BY purchased_at DESC))[1] AS sku, " +
            "SUM(quantity_purchased) AS quantity, SUM(total_cost) AS spend, COUNT(*) AS purchases " +
            "FROM purchases WHERE TRUE" + window.sql() +
            " GROUP BY product_id ORDER BY quantity DESC, spend DESC, product_id LIMIT " + TOP_PRODUCTS_LIMIT,
            (rs, rowNum) -> new PurchasesReport.TopProduct(rs.getObject("product_id", UUID.class),
                    rs.getString("name"), rs.getString("sku"), rs.getLong("quantity"),
                    Money.orZero(rs.getBigDecimal("spend")), rs.getLong("purchases")),
            args);

        return PurchasesReport.builder()
            .groupBy(grouping)
            .totals(totals)
            .timeline(timeline)
            .topSuppliers(suppliers)
            .topProducts(topProducts)
            .build();
    }

    // ==================== Stock ====================

    public StockReport getStockReport() {
        List<StockReport.ProductLine> products = jdbcTemplate.query(
            "SELECT id, name, sku, category, selling_price, cost_price, stock_quantity " +
            "FROM products ORDER BY name, sku",
            (rs, rowNum) -> {
                int quantity = rs.getInt("stock_quantity");
                BigDecimal cost = Money.orZero(rs.getBigDecimal("cost_price"));
                return new StockReport.ProductLine(
                    rs.getObject("id", UUID.class),
                    rs.getString("name"),
                    rs.getString("sku"),
                    rs.getString("category"),
                    Money.orZero(rs.getBigDecimal("selling_price")),
                    cost,
                    quantity,
                    Money.times(cost, quantity),
                    StockLevels.isLowStock(quantity),
                    StockLevels.statusOf(quantity));
            });

        BigDecimal totalValue = Money.ZERO;
        long lowStockCount = 0;
        Map<String, long[]> categoryCounts = new LinkedHashMap<>();
        Map<String, BigDecimal> categoryValues = new LinkedHashMap<>();
        List<StockReport.ProductLine> lowStock = new ArrayList<>();
        List<StockReport.ProductLine> outOfStock = new ArrayList<>();

        for (StockReport.ProductLine line : products) {
            totalValue = totalValue.add(line.getStockValue());
            if (line.isLowStock()) {
                lowStockCount++;
            }
            if (line.getStatus() == StockStatus.LOW_STOCK) {
                lowStock.add(line);
            } else if (line.getStatus() == StockStatus.OUT_OF_STOCK) {
                outOfStock.add(line);
            }
            long[] counts = categoryCounts.computeIfAbsent(line.getCategory(), c -> new long[2]);
            counts[0]++;
            counts[1] += line.getStockQuantity();
            categoryValues.merge(line.getCategory(), line.getStockValue(), BigDecimal::add);
        }
        lowStock.sort((a, b) -> Integer.compare(a.getStockQuantity(), b.getStockQuantity()));

        List<StockReport.CategoryRollup> categories = new ArrayList<>();
        categoryCounts.entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .forEach(e -> categories.add(new StockReport.CategoryRollup(e.getKey(), e.getValue()[0],
                    e.getValue()[1], categoryValues.get(e.getKey()))));

        return StockReport.builder()
            .totals(new StockReport.Totals(totalValue, products.size(), lowStockCount, outOfStock.size()))
            .categories(categories)
            .lowStockProducts(lowStock)
            .outOfStockProducts(outOfStock)
            .products(products)
            .build();
    }

    // ==================== Expenses ====================

    public ExpensesReport getExpensesReport(DateRange range, GroupBy groupBy) {
        DateRange effective = range != null ? range : DateRange.unbounded();
        GroupBy grouping = groupBy != null ? groupBy : GroupBy.DAY;
        DateWindow window = DateWindow.of("expense_date", effective);
        Object[] args = window.args();

        ExpensesReport.Totals totals = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) AS amount, COUNT(*) AS count FROM expenses WHERE TRUE" + window.sql(),
            (rs, rowNum) -> {
                BigDecimal amount = Money.orZero(rs.getBigDecimal("amount"));
                long count = rs.getLong("count");
                return new ExpensesReport.Totals(amount, count, Money.average(amount, count));
            },
            args);

        List<ExpensesReport.Period> timeline = jdbcTemplate.query(
            "SELECT to_char(expense_date, '" + grouping.postgresPattern() + "') AS period, " +
            "SUM(amount) AS amount, COUNT(*) AS count " +
            "FROM expenses WHERE TRUE" + window.sql() + " GROUP BY 1 ORDER BY 1",
            (rs, rowNum) -> new ExpensesReport.Period(rs.getString("period"),
                    Money.orZero(rs.getBigDecimal("amount")), rs.getLong("count")),
            args);

        List<ExpensesReport.CategoryShare> categories = jdbcTemplate.query(
            "SELECT category, SUM(amount) AS total, COUNT(*) AS count " +
            "FROM expenses WHERE TRUE" + window.sql() + " GROUP BY category ORDER BY total DESC, category",
            (rs, rowNum) -> {
                BigDecimal total = Money.orZero(rs.getBigDecimal("total"));
                return new ExpensesReport.CategoryShare(ExpenseCategory.valueOf(rs.getString("category")),
                        total, rs.getLong("count"), Money.percentage(total, totals.getAmount()));
            },
            args);

        List<ExpensesReport.TopExpense> topExpenses = jdbcTemplate.query(
            "SELECT id, category, amount, description, expense_date FROM expenses WHERE TRUE" + window.sql() +
            " ORDER BY amount DESC, expense_date DESC, id LIMIT " + TOP_EXPENSES_LIMIT,
            (rs, rowNum) -> new ExpensesReport.TopExpense(rs.getObject("id", UUID.class),
                    ExpenseCategory.valueOf(rs.getString("category")), Money.orZero(rs.getBigDecimal("amount")),
                    rs.getString("description"), rs.getObject("expense_date", LocalDate.class)),
            args);

        return ExpensesReport.builder()
            .groupBy(grouping)
            .totals(totals)
            .timeline(timeline)
            .categories(categories)
            .topExpenses(topExpenses)
            .monthlyTrend(monthlyExpenseTrend())
            .build();
    }

    /**
     * Six calendar months ending with the current one; months without expenses
     * are present with zero.
     */
    List<ExpensesReport.Period> monthlyExpenseTrend() {
        YearMonth current = YearMonth.now(clock.withZone(organizationZone));
        YearMonth first = current.minusMonths(EXPENSE_TREND_MONTHS - 1L);

        Map<String, ExpensesReport.Period> byMonth = new LinkedHashMap<>();
        for (YearMonth month = first; !month.isAfter(current); month = month.plusMonths(1)) {
            String label = GroupBy.MONTH.label(month.atDay(1));
            byMonth.put(label, new ExpensesReport.Period(label, Money.ZERO, 0));
        }

        jdbcTemplate.query(
            "SELECT to_char(expense_date, '" + GroupBy.MONTH.postgresPattern() + "') AS period, " +
            "SUM(amount) AS amount, COUNT(*) AS count FROM expenses " +
            "WHERE expense_date >= ? AND expense_date <= ? GROUP BY 1",
            rs -> {
                String period = rs.getString("period");
                byMonth.put(period, new ExpensesReport.Period(period,
                        Money.orZero(rs.getBigDecimal("amount")), rs.getLong("count")));
            },
            first.atDay(1), current.atEndOfMonth());

        return List.copyOf(byMonth.values());
    }

    // ==================== Dashboard ====================

    public DashboardSummary getDashboardSummary() {
        LocalDate today = LocalDate.now(clock.withZone(organizationZone));
        Timestamp startOfToday = Timestamp.from(today.atStartOfDay(organizationZone).toInstant());
        Timestamp startOfTomorrow = Timestamp.from(today.plusDays(1).atStartOfDay(organizationZone).toInstant());

        Map<String, Object> todayPaid = jdbcTemplate.queryForMap(
            "SELECT COALESCE(SUM(total_price), 0) AS revenue, COUNT(*) AS orders FROM sales " +
            "WHERE payment_status = 'PAID' AND sold_at >= ? AND sold_at < ?",
            startOfToday, startOfTomorrow);

        List<DashboardSummary.TopProductToday> top = jdbcTemplate.query(
            "SELECT product_id, " +
            "(ARRAY_AGG(product_name ORDER BY sold_at DESC))[1] AS name, " +
            "(ARRAY_AGG(product_sku ORDER BY sold_at DESC))[1] AS sku, " +
            "SUM(quantity_sold) AS quantity FROM sales " +
            "WHERE sold_at >= ? AND sold_at < ? " +
            "GROUP BY product_id ORDER BY quantity DESC, product_id LIMIT 1",
            (rs, rowNum) -> new DashboardSummary.TopProductToday(rs.getObject("product_id", UUID.class),
                    rs.getString("name"), rs.getString("sku"), rs.getLong("quantity")),
            startOfToday, startOfTomorrow);

        Long lowStockCount = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM products WHERE stock_quantity <= ?", Long.class, StockLevels.LOW_STOCK_THRESHOLD);
        Long pendingPayments = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM sales WHERE payment_status = 'PENDING'", Long.class);

        return DashboardSummary.builder()
            .date(today)
            .todayRevenue(Money.orZero((BigDecimal) todayPaid.get("revenue")))
            .todayOrders(((Number) todayPaid.get("orders")).longValue())
            .topProductToday(top.isEmpty() ? null : top.get(0))
            .lowStockCount(lowStockCount != null ? lowStockCount : 0)
            .pendingPayments(pendingPayments != null ? pendingPayments : 0)
            .revenueSeries(dailyRevenue(today))
            .build();
    }

    private List<DashboardSummary.DailyRevenue> dailyRevenue(LocalDate today) {
        LocalDate first = today.minusDays(DASHBOARD_DAYS - 1L);
        Map<LocalDate, BigDecimal> byDay = new LinkedHashMap<>();
        for (LocalDate day = first; !day.isAfter(today); day = day.plusDays(1)) {
            byDay.put(day, Money.ZERO);
        }

        jdbcTemplate.query(
            "SELECT (sold_at AT TIME ZONE CAST(? AS text))::date AS day, SUM(total_price) AS revenue FROM sales " +
            "WHERE payment_status = 'PAID' AND sold_at >= ? AND sold_at < ? GROUP BY 1",
            rs -> {
                byDay.put(rs.getObject("day", LocalDate.class), Money.orZero(rs.getBigDecimal("revenue")));
            },
            organizationZone.getId(),
            Timestamp.from(first.atStartOfDay(organizationZone).toInstant()),
            Timestamp.from(today.plusDays(1).atStartOfDay(organizationZone).toInstant()));

        List<DashboardSummary.DailyRevenue> series = new ArrayList<>(byDay.size());
        byDay.forEach((day, revenue) -> series.add(new DashboardSummary.DailyRevenue(day, revenue)));
        return series;
    }

    private static Object[] prepend(Object first, Object[] rest) {
        Object[] all = new Object[rest.length + 1];
        all[0] = first;
        System.arraycopy(rest, 0, all, 1, rest.length);
        return all;
    }

    /**
     * Optional half-open instant bounds on a timestamp column.
     */
    private static final class TimeWindow {
        private final String column;
        private final Instant start;
        private final Instant end;

        private TimeWindow(String column, Instant start, Instant end) {
            this.column = column;
            this.start = start;
            this.end = end;
        }

        static TimeWindow of(String column, DateRange range, ZoneId zone) {
            return new TimeWindow(column, range.startInclusive(zone), range.endExclusive(zone));
        }

        String sql() {
            StringBuilder sql = new StringBuilder();
            if (start != null) {
                sql.append(" AND ").append(column).append(" >= ?");
            }
            if (end != null) {
                sql.append(" AND ").append(column).append(" < ?");
            }
            return sql.toString();
        }

        Object[] args(Object... leading) {
            List<Object> args = new ArrayList<>(List.of(leading));
            if (start != null) {
                args.add(Timestamp.from(start));
            }
            if (end != null) {
                args.add(Timestamp.from(end));
            }
            return args.toArray();
        }
    }

    /**
     * Optional inclusive bounds on a DATE column.
     */
    private static final class DateWindow {
        private final String column;
        private final LocalDate from;
        private final LocalDate to;

        private DateWindow(String column, LocalDate from, LocalDate to) {
            this.column = column;
            this.from = from;
            this.to = to;
        }

        static DateWindow of(String column, DateRange range) {
            return new DateWindow(column, range.getFrom(), range.getTo());
        }

        String sql() {
            StringBuilder sql = new StringBuilder();
            if (from != null) {
                sql.append(" AND ").append(column).append(" >= ?");
            }
            if (to != null) {
                sql.append(" AND ").append(column).append(" <= ?");
            }
            return sql.toString();
        }

        Object[] args() {
            List<Object> args = new ArrayList<>();
            if (from != null) {
                args.add(from);
            }
            if (to != null) {
                args.add(to);
            }
            return args.toArray();
        }
    }
}

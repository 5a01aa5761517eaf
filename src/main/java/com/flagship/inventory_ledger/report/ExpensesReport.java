package com.flagship.inventory_ledger.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.expense.ExpenseCategory;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Expenses over a date range. The monthly trend always covers the six calendar
 * months ending with the current one, whatever the range.
 */
@Value
@Builder
public class ExpensesReport {

    public static final List<String> TABLE_COLUMNS = List.of("Period", "Amount", "Count");

    @JsonProperty("group_by")
    GroupBy groupBy;

    @JsonProperty("totals")
    Totals totals;

    @JsonProperty("timeline")
    List<Period> timeline;

    @JsonProperty("categories")
    List<CategoryShare> categories;

    @JsonProperty("top_expenses")
    List<TopExpense> topExpenses;

    @JsonProperty("monthly_trend")
    List<Period> monthlyTrend;

    public ReportTable toTable() {
        return ReportTable.of(TABLE_COLUMNS, timeline.stream()
            .map(p -> List.of(p.getPeriod(), p.getAmount().toPlainString(), String.valueOf(p.getCount())))
            .toList());
    }

    @Value
    public static class Totals {
        @JsonProperty("amount")
        BigDecimal amount;
        @JsonProperty("count")
        long count;
        @JsonProperty("average_amount")
        BigDecimal averageAmount;
    }

    @Value
    public static class Period {
        @JsonProperty("period")
        String period;
        @JsonProperty("amount")
        BigDecimal amount;
        @JsonProperty("count")
        long count;
    }

    @Value
    public static class CategoryShare {
        @JsonProperty("category")
        ExpenseCategory category;
        @JsonProperty("total")
        BigDecimal total;
        @JsonProperty("count")
        long count;
        @JsonProperty("percentage")
        BigDecimal percentage;
    }

    @Value
    public static class TopExpense {
        @JsonProperty("id")
        UUID id;
        @JsonProperty("category")
        ExpenseCategory category;
        @JsonProperty("amount")
        BigDecimal amount;
        @JsonProperty("description")
        String description;
        @JsonProperty("date")
        LocalDate date;
    }
}

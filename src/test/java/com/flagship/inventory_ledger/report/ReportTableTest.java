package com.flagship.inventory_ledger.report;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReportTableTest {

    @Test
    @DisplayName("Rows must match the column count")
    void rowWidthChecked() {
        assertThrows(IllegalArgumentException.class, () ->
                ReportTable.of(List.of("A", "B"), List.of(List.of("only one"))));
    }

    @Test
    @DisplayName("Expense timeline flattens to Period, Amount, Count")
    void expensesTable() {
        ExpensesReport report = ExpensesReport.builder()
                .groupBy(GroupBy.MONTH)
                .timeline(List.of(new ExpensesReport.Period("2024-01", new BigDecimal("120.50"), 3)))
                .build();

        ReportTable table = report.toTable();

        assertEquals(List.of("Period", "Amount", "Count"), table.getColumns());
        assertEquals(List.of(List.of("2024-01", "120.50", "3")), table.getRows());
    }
}

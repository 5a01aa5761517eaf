package com.flagship.inventory_ledger.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

/**
 * Fixed flattened projection of a report, one string cell per column, ready
 * for CSV, PDF or spreadsheet rendering.
 */
@Value
public class ReportTable {

    @JsonProperty("columns")
    List<String> columns;

    @JsonProperty("rows")
    List<List<String>> rows;

    public static ReportTable of(List<String> columns, List<List<String>> rows) {
        for (List<String> row : rows) {
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException(
                    "Row has " + row.size() + " cells but the table has " + columns.size() + " columns");
            }
        }
        return new ReportTable(List.copyOf(columns), List.copyOf(rows));
    }
}

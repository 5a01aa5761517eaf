package com.flagship.inventory_ledger.report;

import com.flagship.inventory_ledger.common.Actor;
import com.flagship.inventory_ledger.common.DateRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

/**
 * Report endpoints. Every role may read reports. {@code from} and {@code to}
 * are inclusive calendar days in the organization zone.
 */
@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
@Slf4j
public class ReportController {

    private final ReportingEngine reportingEngine;

    @GetMapping("/sales")
    public SalesReport sales(
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(value = "group_by", required = false) String groupBy,
            Actor actor) {
        log.debug("Sales report requested by {}: from={}, to={}, groupBy={}", actor.getId(), from, to, groupBy);
        return reportingEngine.getSalesReport(DateRange.of(from, to), GroupBy.parse(groupBy));
    }

    @GetMapping("/sales/table")
    public ReportTable salesTable(
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(value = "group_by", required = false) String groupBy,
            Actor actor) {
        return sales(from, to, groupBy, actor).toTable();
    }

    @GetMapping("/purchases")
    public PurchasesReport purchases(
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(value = "group_by", required = false) String groupBy,
            Actor actor) {
        log.debug("Purchases report requested by {}: from={}, to={}, groupBy={}", actor.getId(), from, to, groupBy);
        return reportingEngine.getPurchasesReport(DateRange.of(from, to), GroupBy.parse(groupBy));
    }

    @GetMapping("/purchases/table")
    public ReportTable purchasesTable(
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(value = "group_by", required = false) String groupBy,
            Actor actor) {
        return purchases(from, to, groupBy, actor).toTable();
    }

    @GetMapping("/stock")
    public StockReport stock(Actor actor) {
        log.debug("Stock report requested by {}", actor.getId());
        return reportingEngine.getStockReport();
    }

    @GetMapping("/stock/table")
    public ReportTable stockTable(Actor actor) {
        return stock(actor).toTable();
    }

    @GetMapping("/expenses")
    public ExpensesReport expenses(
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(value = "group_by", required = false) String groupBy,
            Actor actor) {
        log.debug("Expenses report requested by {}: from={}, to={}, groupBy={}", actor.getId(), from, to, groupBy);
        return reportingEngine.getExpensesReport(DateRange.of(from, to), GroupBy.parse(groupBy));
    }

    @GetMapping("/expenses/table")
    public ReportTable expensesTable(
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(value = "group_by", required = false) String groupBy,
            Actor actor) {
        return expenses(from, to, groupBy, actor).toTable();
    }

    @GetMapping("/dashboard")
    public DashboardSummary dashboard(Actor actor) {
        return reportingEngine.getDashboardSummary();
    }
}

package com.flagship.inventory_ledger.expense;

import com.flagship.inventory_ledger.common.Actor;
import com.flagship.inventory_ledger.common.DateRange;
import com.flagship.inventory_ledger.common.PageRequests;
import com.flagship.inventory_ledger.common.PageResponse;
import com.flagship.inventory_ledger.expense.dto.ExpenseRequest;
import com.flagship.inventory_ledger.expense.dto.ExpenseResponse;
import com.flagship.inventory_ledger.report.ExpensesReport;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.UUID;

@RestController
@RequestMapping("/api/expenses")
@RequiredArgsConstructor
public class ExpenseController {

    private final ExpenseService expenseService;

    @PostMapping
    public ResponseEntity<ExpenseResponse> createExpense(@Valid @RequestBody ExpenseRequest request, Actor actor) {
        Expense expense = expenseService.create(request.toDraft(), actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(ExpenseResponse.from(expense));
    }

    @PutMapping("/{id}")
    public ExpenseResponse updateExpense(@PathVariable("id") UUID id,
                                         @Valid @RequestBody ExpenseRequest request,
                                         Actor actor) {
        return ExpenseResponse.from(expenseService.update(id, request.toDraft(), actor));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteExpense(@PathVariable("id") UUID id, Actor actor) {
        expenseService.delete(id, actor);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}")
    public ExpenseResponse getExpense(@PathVariable("id") UUID id, Actor actor) {
        return ExpenseResponse.from(expenseService.get(id, actor));
    }

    @GetMapping
    public PageResponse<ExpenseResponse> listExpenses(
            @RequestParam(value = "category", required = false) ExpenseCategory category,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "size", defaultValue = "" + PageRequests.DEFAULT_SIZE) int size,
            Actor actor) {

        ExpenseFilter filter = ExpenseFilter.builder()
            .category(category)
            .from(from)
            .to(to)
            .build();
        return expenseService.list(filter, page, size, actor).map(ExpenseResponse::from);
    }

    @GetMapping("/stats/summary")
    public ExpensesReport getExpenseStats(
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            Actor actor) {
        return expenseService.stats(DateRange.of(from, to), actor);
    }
}

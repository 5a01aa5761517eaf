package com.flagship.inventory_ledger.expense;

import com.flagship.inventory_ledger.IntegrationTestSupport;
import com.flagship.inventory_ledger.common.DateRange;
import com.flagship.inventory_ledger.common.PageResponse;
import com.flagship.inventory_ledger.common.exception.ForbiddenOperationException;
import com.flagship.inventory_ledger.common.exception.NotFoundException;
import com.flagship.inventory_ledger.common.exception.ValidationException;
import com.flagship.inventory_ledger.report.ExpensesReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ExpenseServiceTest extends IntegrationTestSupport {

    @Autowired
    private ExpenseService expenseService;

    @Autowired
    private ZoneId organizationZone;

    private Expense record(ExpenseCategory category, String amount, LocalDate date) {
        return expenseService.create(ExpenseDraft.builder()
                .category(category)
                .amount(new BigDecimal(amount))
                .description(category.name().toLowerCase() + " costs")
                .expenseDate(date)
                .build(), admin);
    }

    @Test
    @DisplayName("Date defaults to today and method to cash")
    void defaults() {
        Expense expense = expenseService.create(ExpenseDraft.builder()
                .category(ExpenseCategory.FOOD)
                .amount(new BigDecimal("8000"))
                .description("  Staff lunch  ")
                .receiptNumber(" R-001 ")
                .build(), salesClerk);

        assertEquals(LocalDate.now(organizationZone), expense.getExpenseDate());
        assertEquals(ExpensePaymentMethod.CASH, expense.getPaymentMethod());
        assertEquals("Staff lunch", expense.getDescription());
        assertEquals("R-001", expense.getReceiptNumber());
        assertEquals(salesClerk.getId(), expense.getCreatedBy());
    }

    @Test
    @DisplayName("Amount must be positive and the description present")
    void validation() {
        assertThrows(ValidationException.class, () -> record(ExpenseCategory.OTHER, "0", null));
        assertThrows(ValidationException.class, () -> expenseService.create(ExpenseDraft.builder()
                .category(ExpenseCategory.OTHER)
                .amount(BigDecimal.TEN)
                .description(" ")
                .build(), admin));
        assertThrows(ValidationException.class, () -> expenseService.create(ExpenseDraft.builder()
                .category(ExpenseCategory.OTHER)
                .amount(BigDecimal.TEN)
                .description("x".repeat(501))
                .build(), admin));
    }

    @Test
    @DisplayName("Partial update keeps other fields and an empty receipt clears it")
    void partialUpdate() {
        Expense expense = expenseService.create(ExpenseDraft.builder()
                .category(ExpenseCategory.MAINTENANCE)
                .amount(new BigDecimal("50000"))
                .description("Fridge repair")
                .receiptNumber("R-77")
                .build(), admin);

        Expense updated = expenseService.update(expense.getId(), ExpenseDraft.builder()
                .amount(new BigDecimal("45000"))
                .receiptNumber("")
                .build(), salesClerk);

        assertEquals(0, updated.getAmount().compareTo(new BigDecimal("45000")));
        assertEquals("Fridge repair", updated.getDescription());
        assertEquals(ExpenseCategory.MAINTENANCE, updated.getCategory());
        assertNull(updated.getReceiptNumber());
    }

    @Test
    @DisplayName("Only admins delete; stock keepers cannot see expenses at all")
    void roles() {
        Expense expense = record(ExpenseCategory.TAXES, "1000", null);
        UUID id = expense.getId();

        assertThrows(ForbiddenOperationException.class, () -> expenseService.delete(id, salesClerk));
        assertThrows(ForbiddenOperationException.class, () -> expenseService.get(id, stockKeeper));

        expenseService.delete(id, admin);
        assertThrows(NotFoundException.class, () -> expenseService.get(id, admin));
    }

    @Test
    @DisplayName("Listing filters by category and date, newest first")
    void listing() {
        record(ExpenseCategory.TRANSPORT, "100", LocalDate.of(2024, 1, 5));
        record(ExpenseCategory.TRANSPORT, "200", LocalDate.of(2024, 1, 20));
        record(ExpenseCategory.FOOD, "300", LocalDate.of(2024, 1, 10));
        record(ExpenseCategory.TRANSPORT, "400", LocalDate.of(2024, 2, 1));

        PageResponse<Expense> page = expenseService.list(ExpenseFilter.builder()
                .category(ExpenseCategory.TRANSPORT)
                .from(LocalDate.of(2024, 1, 1))
                .to(LocalDate.of(2024, 1, 31))
                .build(), 1, 20, salesClerk);

        assertEquals(2, page.getTotalItems());
        assertEquals(LocalDate.of(2024, 1, 20), page.getItems().get(0).getExpenseDate());
    }

    @Test
    @DisplayName("Stats summarize the range by month")
    void stats() {
        record(ExpenseCategory.TRANSPORT, "100", LocalDate.of(2024, 1, 5));
        record(ExpenseCategory.FOOD, "300", LocalDate.of(2024, 2, 10));

        ExpensesReport stats = expenseService.stats(
                DateRange.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 29)), salesClerk);

        assertEquals(0, stats.getTotals().getAmount().compareTo(new BigDecimal("400")));
        assertEquals(2, stats.getTimeline().size());
        assertEquals("2024-01", stats.getTimeline().get(0).getPeriod());
        assertThrows(ForbiddenOperationException.class, () -> expenseService.stats(DateRange.unbounded(), stockKeeper));
    }
}

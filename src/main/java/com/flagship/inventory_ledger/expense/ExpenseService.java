package com.flagship.inventory_ledger.expense;

import com.flagship.inventory_ledger.common.AccessPolicy;
import com.flagship.inventory_ledger.common.Actor;
import com.flagship.inventory_ledger.common.DateRange;
import com.flagship.inventory_ledger.common.Money;
import com.flagship.inventory_ledger.common.PageRequests;
import com.flagship.inventory_ledger.common.PageResponse;
import com.flagship.inventory_ledger.common.Permission;
import com.flagship.inventory_ledger.common.exception.NotFoundException;
import com.flagship.inventory_ledger.common.exception.ValidationException;
import com.flagship.inventory_ledger.event.ExpenseDeleted;
import com.flagship.inventory_ledger.event.ExpenseRecorded;
import com.flagship.inventory_ledger.event.ExpenseUpdated;
import com.flagship.inventory_ledger.event.LedgerEventPublisher;
import com.flagship.inventory_ledger.ledger.AtomicScope;
import com.flagship.inventory_ledger.report.ExpensesReport;
import com.flagship.inventory_ledger.report.GroupBy;
import com.flagship.inventory_ledger.report.ReportingEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Operating expenses. Independent of stock, but recorded through the same
 * atomic scope so the outbox row commits with the expense.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpenseService {

    static final int MAX_DESCRIPTION_LENGTH = 500;
    static final int MAX_RECEIPT_LENGTH = 100;

    private final ExpenseRepository expenseRepository;
    private final AtomicScope atomicScope;
    private final LedgerEventPublisher eventPublisher;
    private final ReportingEngine reportingEngine;
    private final Clock clock;
    private final ZoneId organizationZone;

    public Expense create(ExpenseDraft draft, Actor actor) {
        AccessPolicy.require(actor, Permission.MANAGE_EXPENSES);
        if (draft == null || draft.getCategory() == null) {
            throw new ValidationException("category is required");
        }
        BigDecimal amount = Money.requirePositive(draft.getAmount(), "amount");
        String description = requireDescription(draft.getDescription());
        String receipt = validateReceipt(draft.getReceiptNumber());
        LocalDate date = draft.getExpenseDate() != null ? draft.getExpenseDate() : LocalDate.now(clock.withZone(organizationZone));
        ExpensePaymentMethod method = draft.getPaymentMethod() != null
                ? draft.getPaymentMethod() : ExpensePaymentMethod.CASH;

        Expense expense = atomicScope.execute("create_expense", () -> {
            Expense saved = expenseRepository.saveAndFlush(ExpenseEntity.create(draft.getCategory(), amount,
                    description, date, method, receipt, actor.getId())).toDomain();
            eventPublisher.publish(ExpenseRecorded.of(saved, actor, clock.instant()));
            return saved;
        });

        log.info("Expense recorded: expenseId={}, category={}, amount={}",
                expense.getId(), expense.getCategory(), expense.getAmount());
        return expense;
    }

    /**
     * Partial update; null draft fields keep their value. An empty receipt
     * number clears it.
     */
    public Expense update(UUID expenseId, ExpenseDraft draft, Actor actor) {
        AccessPolicy.require(actor, Permission.MANAGE_EXPENSES);
        if (draft == null) {
            throw new ValidationException("No changes supplied");
        }
        BigDecimal newAmount = draft.getAmount() != null ? Money.requirePositive(draft.getAmount(), "amount") : null;
        String newDescription = draft.getDescription() != null ? requireDescription(draft.getDescription()) : null;
        String newReceipt = validateReceipt(draft.getReceiptNumber());

        Expense updated = atomicScope.execute("update_expense", () -> {
            ExpenseEntity entity = expenseRepository.findById(expenseId)
                .orElseThrow(() -> new NotFoundException("Expense", expenseId));
            Expense before = entity.toDomain();

            entity.revise(
                draft.getCategory() != null ? draft.getCategory() : before.getCategory(),
                newAmount != null ? newAmount : before.getAmount(),
                newDescription != null ? newDescription : before.getDescription(),
                draft.getExpenseDate() != null ? draft.getExpenseDate() : before.getExpenseDate(),
                draft.getPaymentMethod() != null ? draft.getPaymentMethod() : before.getPaymentMethod(),
                draft.getReceiptNumber() != null ? newReceipt : before.getReceiptNumber()
            );
            Expense after = expenseRepository.saveAndFlush(entity).toDomain();
            eventPublisher.publish(ExpenseUpdated.of(after, changedFields(before, after), actor, clock.instant()));
            return after;
        });

        log.info("Expense updated: expenseId={}", expenseId);
        return updated;
    }

    public Expense delete(UUID expenseId, Actor actor) {
        AccessPolicy.require(actor, Permission.DELETE_EXPENSES);

        Expense deleted = atomicScope.execute("delete_expense", () -> {
            ExpenseEntity entity = expenseRepository.findById(expenseId)
                .orElseThrow(() -> new NotFoundException("Expense", expenseId));
            Expense snapshot = entity.toDomain();
            expenseRepository.delete(entity);
            eventPublisher.publish(ExpenseDeleted.of(snapshot, actor, clock.instant()));
            return snapshot;
        });

        log.info("Expense deleted: expenseId={}", expenseId);
        return deleted;
    }

    public Expense get(UUID expenseId, Actor actor) {
        AccessPolicy.require(actor, Permission.MANAGE_EXPENSES);
        return expenseRepository.findById(expenseId)
            .map(ExpenseEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Expense", expenseId));
    }

    public PageResponse<Expense> list(ExpenseFilter filter, int page, int size, Actor actor) {
        AccessPolicy.require(actor, Permission.MANAGE_EXPENSES);
        ExpenseFilter effective = filter != null ? filter : ExpenseFilter.builder().build();
        return PageResponse.from(
            expenseRepository.findAll(ExpenseSpecifications.matching(effective),
                    PageRequests.newestFirst(page, size, "expenseDate")),
            ExpenseEntity::toDomain);
    }

    /**
     * Totals, category shares, largest expenses and the trailing six-month
     * trend for the range, bucketed by month.
     */
    public ExpensesReport stats(DateRange range, Actor actor) {
        AccessPolicy.require(actor, Permission.MANAGE_EXPENSES);
        return reportingEngine.getExpensesReport(range, GroupBy.MONTH);
    }

    private static String requireDescription(String description) {
        if (description == null || description.isBlank()) {
            throw new ValidationException("description is required");
        }
        String trimmed = description.trim();
        if (trimmed.length() > MAX_DESCRIPTION_LENGTH) {
            throw new ValidationException("description cannot exceed " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        return trimmed;
    }

    private static String validateReceipt(String receiptNumber) {
        if (receiptNumber == null || receiptNumber.isBlank()) {
            return null;
        }
        String trimmed = receiptNumber.trim();
        if (trimmed.length() > MAX_RECEIPT_LENGTH) {
            throw new ValidationException("receiptNumber cannot exceed " + MAX_RECEIPT_LENGTH + " characters");
        }
        return trimmed;
    }

    private static List<String> changedFields(Expense before, Expense after) {
        List<String> changed = new ArrayList<>();
        if (before.getCategory() != after.getCategory()) {
            changed.add("category");
        }
        if (before.getAmount().compareTo(after.getAmount()) != 0) {
            changed.add("amount");
        }
        if (!Objects.equals(before.getDescription(), after.getDescription())) {
            changed.add("description");
        }
        if (!Objects.equals(before.getExpenseDate(), after.getExpenseDate())) {
            changed.add("expenseDate");
        }
        if (before.getPaymentMethod() != after.getPaymentMethod()) {
            changed.add("paymentMethod");
        }
        if (!Objects.equals(before.getReceiptNumber(), after.getReceiptNumber())) {
            changed.add("receiptNumber");
        }
        return changed;
    }
}

package com.flagship.inventory_ledger.event;

import com.flagship.inventory_ledger.common.Actor;
import com.flagship.inventory_ledger.common.Role;
import com.flagship.inventory_ledger.expense.Expense;
import com.flagship.inventory_ledger.expense.ExpenseCategory;
import com.flagship.inventory_ledger.expense.ExpensePaymentMethod;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class ExpenseRecorded implements InventoryEvent {
    UUID eventId;
    UUID expenseId;
    ExpenseCategory category;
    BigDecimal amount;
    String description;
    LocalDate expenseDate;
    ExpensePaymentMethod paymentMethod;
    UUID actorId;
    Role actorRole;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ExpenseRecorded";

    @Override
    public String getAggregateType() {
        return "Expense";
    }

    @Override
    public UUID getAggregateId() {
        return expenseId;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ExpenseRecorded of(Expense expense, Actor actor, Instant occurredAt) {
        return new ExpenseRecorded(
            UUID.randomUUID(),
            expense.getId(),
            expense.getCategory(),
            expense.getAmount(),
            expense.getDescription(),
            expense.getExpenseDate(),
            expense.getPaymentMethod(),
            actor.getId(),
            actor.getRole(),
            occurredAt
        );
    }
}

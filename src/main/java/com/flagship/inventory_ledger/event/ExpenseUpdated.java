package com.flagship.inventory_ledger.event;

import com.flagship.inventory_ledger.common.Actor;
import com.flagship.inventory_ledger.common.Role;
import com.flagship.inventory_ledger.expense.Expense;
import com.flagship.inventory_ledger.expense.ExpenseCategory;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class ExpenseUpdated implements InventoryEvent {
    UUID eventId;
    UUID expenseId;
    ExpenseCategory category;
    BigDecimal amount;
    List<String> changedFields;
    UUID actorId;
    Role actorRole;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ExpenseUpdated";

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

    public static ExpenseUpdated of(Expense expense, List<String> changedFields, Actor actor, Instant occurredAt) {
        return new ExpenseUpdated(
            UUID.randomUUID(),
            expense.getId(),
            expense.getCategory(),
            expense.getAmount(),
            List.copyOf(changedFields),
            actor.getId(),
            actor.getRole(),
            occurredAt
        );
    }
}

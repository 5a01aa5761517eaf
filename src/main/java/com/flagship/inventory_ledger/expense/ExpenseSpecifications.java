package com.flagship.inventory_ledger.expense;

import com.flagship.inventory_ledger.common.DateRange;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;

final class ExpenseSpecifications {

    private ExpenseSpecifications() {
    }

    static Specification<ExpenseEntity> matching(ExpenseFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            DateRange range = DateRange.of(filter.getFrom(), filter.getTo());

            if (range.getFrom() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("expenseDate"), range.getFrom()));
            }
            if (range.getTo() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("expenseDate"), range.getTo()));
            }
            if (filter.getCategory() != null) {
                predicates.add(cb.equal(root.get("category"), filter.getCategory()));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}

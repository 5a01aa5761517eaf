package com.flagship.inventory_ledger.purchase;

import com.flagship.inventory_ledger.common.DateRange;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

final class PurchaseSpecifications {

    private PurchaseSpecifications() {
    }

    static Specification<PurchaseEntity> matching(PurchaseFilter filter, ZoneId zone) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            DateRange range = DateRange.of(filter.getFrom(), filter.getTo());

            Instant start = range.startInclusive(zone);
            if (start != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("purchasedAt"), start));
            }
            Instant end = range.endExclusive(zone);
            if (end != null) {
                predicates.add(cb.lessThan(root.get("purchasedAt"), end));
            }
            if (filter.getProductId() != null) {
                predicates.add(cb.equal(root.get("productId"), filter.getProductId()));
            }
            if (filter.getSupplier() != null && !filter.getSupplier().isBlank()) {
                String pattern = "%" + filter.getSupplier().trim().toLowerCase(Locale.ROOT) + "%";
                predicates.add(cb.like(cb.lower(root.get("supplier")), pattern));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}

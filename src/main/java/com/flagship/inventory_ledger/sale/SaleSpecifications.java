package com.flagship.inventory_ledger.sale;

import com.flagship.inventory_ledger.common.DateRange;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

final class SaleSpecifications {

    private SaleSpecifications() {
    }

    static Specification<SaleEntity> matching(SaleFilter filter, ZoneId zone) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            DateRange range = DateRange.of(filter.getFrom(), filter.getTo());

            Instant start = range.startInclusive(zone);
            if (start != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("soldAt"), start));
            }
            Instant end = range.endExclusive(zone);
            if (end != null) {
                predicates.add(cb.lessThan(root.get("soldAt"), end));
            }
            if (filter.getProductId() != null) {
                predicates.add(cb.equal(root.get("productId"), filter.getProductId()));
            }
            if (filter.getPaymentStatus() != null) {
                predicates.add(cb.equal(root.get("paymentStatus"), filter.getPaymentStatus()));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}

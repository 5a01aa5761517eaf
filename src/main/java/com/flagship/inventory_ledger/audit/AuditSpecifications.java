package com.flagship.inventory_ledger.audit;

import com.flagship.inventory_ledger.common.DateRange;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

final class AuditSpecifications {

    private AuditSpecifications() {
    }

    static Specification<AuditEntryEntity> matching(AuditQuery query, ZoneId zone) {
        return (root, criteria, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (query.getActorId() != null) {
                predicates.add(cb.equal(root.get("actorId"), query.getActorId()));
            }
            if (query.getAction() != null) {
                predicates.add(cb.equal(root.get("action"), query.getAction()));
            }
            if (query.getEntityType() != null) {
                predicates.add(cb.equal(root.get("entityType"), query.getEntityType()));
            }
            if (query.getEntityId() != null) {
                predicates.add(cb.equal(root.get("entityId"), query.getEntityId()));
            }

            DateRange range = DateRange.of(query.getFrom(), query.getTo());
            Instant start = range.startInclusive(zone);
            if (start != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("createdAt"), start));
            }
            Instant end = range.endExclusive(zone);
            if (end != null) {
                predicates.add(cb.lessThan(root.get("createdAt"), end));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}

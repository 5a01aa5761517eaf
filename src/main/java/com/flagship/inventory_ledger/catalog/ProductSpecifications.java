package com.flagship.inventory_ledger.catalog;

import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

final class ProductSpecifications {

    private ProductSpecifications() {
    }

    static Specification<ProductEntity> matching(ProductFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (filter.getSearch() != null && !filter.getSearch().isBlank()) {
                String pattern = "%" + filter.getSearch().trim().toLowerCase(Locale.ROOT) + "%";
                predicates.add(cb.or(
                    cb.like(cb.lower(root.get("name")), pattern),
                    cb.like(cb.lower(root.get("sku")), pattern)
                ));
            }
            if (filter.getCategory() != null && !filter.getCategory().isBlank()) {
                predicates.add(cb.equal(root.get("category"), filter.getCategory().trim()));
            }
            if (filter.isLowStockOnly()) {
                predicates.add(cb.le(root.get("stockQuantity"), StockLevels.LOW_STOCK_THRESHOLD));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}

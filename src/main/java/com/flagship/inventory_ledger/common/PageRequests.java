package com.flagship.inventory_ledger.common;

import com.flagship.inventory_ledger.common.exception.ValidationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/**
 * Validates 1-based page parameters and builds a newest-first {@link Pageable}.
 */
public final class PageRequests {

    public static final int DEFAULT_SIZE = 20;
    public static final int MAX_SIZE = 100;

    private PageRequests() {
    }

    public static Pageable newestFirst(int page, int size, String timestampProperty) {
        if (page < 1) {
            throw new ValidationException("page must be at least 1");
        }
        if (size < 1 || size > MAX_SIZE) {
            throw new ValidationException("size must be between 1 and " + MAX_SIZE);
        }
        return PageRequest.of(page - 1, size,
                Sort.by(Sort.Order.desc(timestampProperty), Sort.Order.desc("id")));
    }
}

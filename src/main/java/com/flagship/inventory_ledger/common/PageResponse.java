package com.flagship.inventory_ledger.common;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;
import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;

/**
 * One page of a newest-first listing. Pages are 1-based on the wire.
 */
@Value
public class PageResponse<T> {

    @JsonProperty("items")
    List<T> items;

    @JsonProperty("page")
    int page;

    @JsonProperty("size")
    int size;

    @JsonProperty("total_items")
    long totalItems;

    @JsonProperty("total_pages")
    int totalPages;

    public static <E, T> PageResponse<T> from(Page<E> page, Function<E, T> mapper) {
        return new PageResponse<>(
            page.getContent().stream().map(mapper).toList(),
            page.getNumber() + 1,
            page.getSize(),
            page.getTotalElements(),
            page.getTotalPages()
        );
    }

    public <R> PageResponse<R> map(Function<T, R> mapper) {
        return new PageResponse<>(items.stream().map(mapper).toList(), page, size, totalItems, totalPages);
    }
}

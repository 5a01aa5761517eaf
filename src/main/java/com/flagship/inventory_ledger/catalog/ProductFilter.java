package com.flagship.inventory_ledger.catalog;

import lombok.Builder;
import lombok.Value;

/**
 * Optional catalog listing filters; null means "no restriction".
 */
@Value
@Builder
public class ProductFilter {
    String search;       // case-insensitive substring of name or SKU
    String category;
    boolean lowStockOnly;

    public static ProductFilter none() {
        return ProductFilter.builder().build();
    }
}

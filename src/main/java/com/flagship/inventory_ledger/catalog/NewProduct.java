package com.flagship.inventory_ledger.catalog;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class NewProduct {
    String name;
    String sku;
    String category;
    String description;
    BigDecimal costPrice;
    BigDecimal sellingPrice;
    Integer openingStock;     // defaults to 0
    Integer reorderLevel;     // defaults to the low-stock threshold
}

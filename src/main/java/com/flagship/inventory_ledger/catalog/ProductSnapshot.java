package com.flagship.inventory_ledger.catalog;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Product fields frozen onto a sale or purchase when it is recorded.
 * Reports read names and SKUs from here, so history survives renames and
 * product deletion.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProductSnapshot {

    @Column(name = "product_name", nullable = false, updatable = false)
    private String name;

    @Column(name = "product_sku", nullable = false, length = 100, updatable = false)
    private String sku;

    @Column(name = "product_price", nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal price;

    public static ProductSnapshot of(String name, String sku, BigDecimal price) {
        return new ProductSnapshot(name, sku, price);
    }
}

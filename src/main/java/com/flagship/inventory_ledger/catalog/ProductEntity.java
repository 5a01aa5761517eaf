package com.flagship.inventory_ledger.catalog;

import com.flagship.inventory_ledger.common.exception.ValidationException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the products table.
 *
 * No setters: the stock counter moves only through {@link #applyStockChange(int)},
 * which the ledger calls while holding the row lock, and catalog fields only
 * through {@link #updateDetails}. The database CHECK on stock_quantity backs
 * the non-negative invariant.
 */
@Entity
@Table(
    name = "products",
    indexes = {
        @Index(name = "uq_products_sku", columnList = "sku", unique = true),
        @Index(name = "idx_products_category", columnList = "category")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProductEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, length = 100)
    private String sku;

    @Column(nullable = false, length = 100)
    private String category;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "cost_price", nullable = false, precision = 19, scale = 2)
    private BigDecimal costPrice;

    @Column(name = "selling_price", nullable = false, precision = 19, scale = 2)
    private BigDecimal sellingPrice;

    @Column(name = "stock_quantity", nullable = false)
    private int stockQuantity;

    @Column(name = "reorder_level", nullable = false)
    private int reorderLevel;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static ProductEntity fromDomain(Product product) {
        return new ProductEntity(
            product.getId(),
            product.getName(),
            product.getSku(),
            product.getCategory(),
            product.getDescription(),
            product.getCostPrice(),
            product.getSellingPrice(),
            product.getStockQuantity(),
            product.getReorderLevel(),
            null,  // version - managed by Hibernate
            null,  // createdAt - set by @PrePersist
            null   // updatedAt - set by @PrePersist
        );
    }

    public Product toDomain() {
        return new Product(
            id,
            name,
            sku,
            category,
            description,
            costPrice,
            sellingPrice,
            stockQuantity,
            reorderLevel,
            version,
            createdAt,
            updatedAt
        );
    }

    /**
     * Moves the stock counter by a signed delta.
     *
     * @throws IllegalStateException if the counter would go below zero; callers
     *         check sufficiency first and raise a typed error
     * @throws ValidationException if the counter would exceed {@link Integer#MAX_VALUE}
     */
    public void applyStockChange(int delta) {
        long next = (long) stockQuantity + delta;
        if (next < 0) {
            throw new IllegalStateException(
                "Stock of product " + id + " cannot go below zero (current " + stockQuantity + ", delta " + delta + ")");
        }
        if (next > Integer.MAX_VALUE) {
            throw new ValidationException(
                "Stock of product " + id + " cannot exceed " + Integer.MAX_VALUE
                    + " (current " + stockQuantity + ", delta " + delta + ")");
        }
        this.stockQuantity = (int) next;
    }

    /**
     * The latest purchase cost replaces the product's cost price.
     */
    public void overwriteCostPrice(BigDecimal unitCost) {
        this.costPrice = unitCost;
    }

    void updateDetails(String name, String sku, String category, String description,
                       BigDecimal costPrice, BigDecimal sellingPrice, int reorderLevel) {
        this.name = name;
        this.sku = sku;
        this.category = category;
        this.description = description;
        this.costPrice = costPrice;
        this.sellingPrice = sellingPrice;
        this.reorderLevel = reorderLevel;
    }
}

package com.flagship.inventory_ledger.purchase;

import com.flagship.inventory_ledger.catalog.ProductSnapshot;
import com.flagship.inventory_ledger.common.Money;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "purchases")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PurchaseEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "product_id", nullable = false, updatable = false)
    private UUID productId;

    @Embedded
    private ProductSnapshot productSnapshot;

    @Column(name = "quantity_purchased", nullable = false)
    private int quantityPurchased;

    @Column(name = "unit_cost", nullable = false, precision = 19, scale = 2)
    private BigDecimal unitCost;

    @Column(name = "total_cost", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalCost;

    @Column(nullable = false)
    private String supplier;

    @Column(name = "purchased_by", nullable = false, updatable = false)
    private UUID purchasedBy;

    @Column(name = "purchased_at", nullable = false, updatable = false)
    private Instant purchasedAt;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

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

    public static PurchaseEntity record(UUID productId, ProductSnapshot snapshot, int quantity,
                                        BigDecimal unitCost, String supplier, UUID purchasedBy,
                                        Instant purchasedAt, String idempotencyKey) {
        return new PurchaseEntity(
            UUID.randomUUID(),
            productId,
            snapshot,
            quantity,
            unitCost,
            Money.total(unitCost, quantity, "totalCost"),
            supplier,
            purchasedBy,
            purchasedAt,
            idempotencyKey,
            null,
            null
        );
    }

    public void revise(int quantity, BigDecimal unitCost, String supplier) {
        this.quantityPurchased = quantity;
        this.unitCost = unitCost;
        this.totalCost = Money.total(unitCost, quantity, "totalCost");
        this.supplier = supplier;
    }

    public Purchase toDomain() {
        return new Purchase(
            id,
            productId,
            productSnapshot,
            quantityPurchased,
            unitCost,
            totalCost,
            supplier,
            purchasedBy,
            purchasedAt,
            updatedAt
        );
    }
}

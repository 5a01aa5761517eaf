package com.flagship.inventory_ledger.sale;

import com.flagship.inventory_ledger.catalog.ProductSnapshot;
import com.flagship.inventory_ledger.common.Money;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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

/**
 * JPA entity for the sales table.
 *
 * Created only through {@link #record}, which freezes the product snapshot and
 * derives the total. The idempotency key is a persistence concern and is not
 * part of the {@link Sale} domain object.
 */
@Entity
@Table(name = "sales")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SaleEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "product_id", nullable = false, updatable = false)
    private UUID productId;

    @Embedded
    private ProductSnapshot productSnapshot;

    @Column(name = "quantity_sold", nullable = false)
    private int quantitySold;

    @Column(name = "unit_price", nullable = false, precision = 19, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "total_price", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalPrice;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, length = 20)
    private PaymentMethod paymentMethod;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Column(name = "sold_by", nullable = false, updatable = false)
    private UUID soldBy;

    @Column(name = "sold_at", nullable = false, updatable = false)
    private Instant soldAt;

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

    public static SaleEntity record(UUID productId, ProductSnapshot snapshot, int quantity,
                                    BigDecimal unitPrice, PaymentMethod paymentMethod,
                                    PaymentStatus paymentStatus, UUID soldBy, Instant soldAt,
                                    String idempotencyKey) {
        return new SaleEntity(
            UUID.randomUUID(),
            productId,
            snapshot,
            quantity,
            unitPrice,
            Money.total(unitPrice, quantity, "totalPrice"),
            paymentMethod,
            paymentStatus,
            soldBy,
            soldAt,
            idempotencyKey,
            null,  // createdAt - set by @PrePersist
            null   // updatedAt - set by @PrePersist
        );
    }

    /**
     * Applies new values and recomputes the total. Stock effects are the
     * caller's responsibility.
     */
    public void revise(int quantity, BigDecimal unitPrice, PaymentMethod paymentMethod,
                       PaymentStatus paymentStatus) {
        this.quantitySold = quantity;
        this.unitPrice = unitPrice;
        this.totalPrice = Money.total(unitPrice, quantity, "totalPrice");
        this.paymentMethod = paymentMethod;
        this.paymentStatus = paymentStatus;
    }

    public void changePaymentStatus(PaymentStatus paymentStatus) {
        this.paymentStatus = paymentStatus;
    }

    public Sale toDomain() {
        return new Sale(
            id,
            productId,
            productSnapshot,
            quantitySold,
            unitPrice,
            totalPrice,
            paymentMethod,
            paymentStatus,
            soldBy,
            soldAt,
            updatedAt
        );
    }
}

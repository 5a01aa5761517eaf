package com.flagship.inventory_ledger.sale;

import com.flagship.inventory_ledger.catalog.ProductSnapshot;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A recorded sale. The product id may dangle after the product is deleted;
 * the snapshot keeps what was sold.
 */
@Value
public class Sale {
    UUID id;
    UUID productId;
    ProductSnapshot productSnapshot;
    int quantitySold;
    BigDecimal unitPrice;
    BigDecimal totalPrice;
    PaymentMethod paymentMethod;
    PaymentStatus paymentStatus;
    UUID soldBy;
    Instant soldAt;
    Instant updatedAt;

    public boolean isPaid() {
        return paymentStatus == PaymentStatus.PAID;
    }
}

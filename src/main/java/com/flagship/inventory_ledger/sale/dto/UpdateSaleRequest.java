package com.flagship.inventory_ledger.sale.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.sale.PaymentMethod;
import com.flagship.inventory_ledger.sale.PaymentStatus;
import com.flagship.inventory_ledger.sale.SaleChanges;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Partial update; absent fields keep their value.
 */
@Value
public class UpdateSaleRequest {

    @Min(value = 1, message = "Quantity must be at least 1")
    @JsonProperty("quantity")
    Integer quantity;

    @DecimalMin(value = "0.00", message = "Unit price cannot be negative")
    @JsonProperty("unit_price")
    BigDecimal unitPrice;

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @JsonProperty("payment_status")
    PaymentStatus paymentStatus;

    public SaleChanges toChanges() {
        return SaleChanges.builder()
            .quantity(quantity)
            .unitPrice(unitPrice)
            .paymentMethod(paymentMethod)
            .paymentStatus(paymentStatus)
            .build();
    }
}

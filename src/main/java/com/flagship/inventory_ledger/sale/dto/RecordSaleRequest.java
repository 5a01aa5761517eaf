package com.flagship.inventory_ledger.sale.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.sale.PaymentMethod;
import com.flagship.inventory_ledger.sale.PaymentStatus;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class RecordSaleRequest {

    @NotNull(message = "Product ID is required")
    @JsonProperty("product_id")
    UUID productId;

    @NotNull(message = "Quantity is required")
    @Min(value = 1, message = "Quantity must be at least 1")
    @JsonProperty("quantity")
    Integer quantity;

    @NotNull(message = "Unit price is required")
    @DecimalMin(value = "0.00", message = "Unit price cannot be negative")
    @JsonProperty("unit_price")
    BigDecimal unitPrice;

    @NotNull(message = "Payment method is required")
    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    // Defaults to PAID
    @JsonProperty("payment_status")
    PaymentStatus paymentStatus;
}

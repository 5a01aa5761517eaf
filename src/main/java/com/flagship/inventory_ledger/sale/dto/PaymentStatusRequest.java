package com.flagship.inventory_ledger.sale.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.sale.PaymentStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class PaymentStatusRequest {

    @NotNull(message = "Payment status is required")
    @JsonProperty("payment_status")
    PaymentStatus paymentStatus;
}

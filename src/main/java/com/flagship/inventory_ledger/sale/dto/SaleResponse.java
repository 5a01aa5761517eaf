package com.flagship.inventory_ledger.sale.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.sale.PaymentMethod;
import com.flagship.inventory_ledger.sale.PaymentStatus;
import com.flagship.inventory_ledger.sale.Sale;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class SaleResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("product_id")
    UUID productId;

    @JsonProperty("product_name")
    String productName;

    @JsonProperty("product_sku")
    String productSku;

    @JsonProperty("product_price")
    BigDecimal productPrice;

    @JsonProperty("quantity_sold")
    int quantitySold;

    @JsonProperty("unit_price")
    BigDecimal unitPrice;

    @JsonProperty("total_price")
    BigDecimal totalPrice;

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @JsonProperty("payment_status")
    PaymentStatus paymentStatus;

    @JsonProperty("sold_by")
    UUID soldBy;

    @JsonProperty("sold_at")
    Instant soldAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static SaleResponse from(Sale sale) {
        return SaleResponse.builder()
            .id(sale.getId())
            .productId(sale.getProductId())
            .productName(sale.getProductSnapshot().getName())
            .productSku(sale.getProductSnapshot().getSku())
            .productPrice(sale.getProductSnapshot().getPrice())
            .quantitySold(sale.getQuantitySold())
            .unitPrice(sale.getUnitPrice())
            .totalPrice(sale.getTotalPrice())
            .paymentMethod(sale.getPaymentMethod())
            .paymentStatus(sale.getPaymentStatus())
            .soldBy(sale.getSoldBy())
            .soldAt(sale.getSoldAt())
            .updatedAt(sale.getUpdatedAt())
            .build();
    }
}

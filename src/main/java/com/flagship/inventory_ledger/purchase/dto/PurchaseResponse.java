package com.flagship.inventory_ledger.purchase.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.purchase.Purchase;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PurchaseResponse {

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

    @JsonProperty("quantity_purchased")
    int quantityPurchased;

    @JsonProperty("unit_cost")
    BigDecimal unitCost;

    @JsonProperty("total_cost")
    BigDecimal totalCost;

    @JsonProperty("supplier")
    String supplier;

    @JsonProperty("purchased_by")
    UUID purchasedBy;

    @JsonProperty("purchased_at")
    Instant purchasedAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static PurchaseResponse from(Purchase purchase) {
        return PurchaseResponse.builder()
            .id(purchase.getId())
            .productId(purchase.getProductId())
            .productName(purchase.getProductSnapshot().getName())
            .productSku(purchase.getProductSnapshot().getSku())
            .productPrice(purchase.getProductSnapshot().getPrice())
            .quantityPurchased(purchase.getQuantityPurchased())
            .unitCost(purchase.getUnitCost())
            .totalCost(purchase.getTotalCost())
            .supplier(purchase.getSupplier())
            .purchasedBy(purchase.getPurchasedBy())
            .purchasedAt(purchase.getPurchasedAt())
            .updatedAt(purchase.getUpdatedAt())
            .build();
    }
}

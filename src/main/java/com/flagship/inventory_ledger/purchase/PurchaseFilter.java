package com.flagship.inventory_ledger.purchase;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class PurchaseFilter {
    LocalDate from;
    LocalDate to;
    UUID productId;
    String supplier;     // case-insensitive substring
}

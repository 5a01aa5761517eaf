package com.flagship.inventory_ledger.sale;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Sale listing filters. Dates are calendar days in the organization zone,
 * both ends inclusive; nulls mean unbounded.
 */
@Value
@Builder
public class SaleFilter {
    LocalDate from;
    LocalDate to;
    UUID productId;
    PaymentStatus paymentStatus;
}

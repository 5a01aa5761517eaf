package com.flagship.inventory_ledger.audit;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Audit log filters; null fields do not restrict. Dates are calendar days in
 * the organization zone, inclusive.
 */
@Value
@Builder
public class AuditQuery {
    UUID actorId;
    AuditAction action;
    AuditEntityType entityType;
    UUID entityId;
    LocalDate from;
    LocalDate to;
}

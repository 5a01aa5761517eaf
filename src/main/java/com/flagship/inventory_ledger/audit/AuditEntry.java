package com.flagship.inventory_ledger.audit;

import com.flagship.inventory_ledger.common.Role;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable record of one action. The entity id is absent for actions that
 * target no single row.
 */
@Value
public class AuditEntry {
    UUID id;
    UUID actorId;
    Role actorRole;
    AuditAction action;
    AuditEntityType entityType;
    UUID entityId;
    Map<String, Object> metadata;
    Instant createdAt;
}

package com.flagship.inventory_ledger.audit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.audit.AuditAction;
import com.flagship.inventory_ledger.audit.AuditEntityType;
import com.flagship.inventory_ledger.audit.AuditEntry;
import com.flagship.inventory_ledger.common.Role;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class AuditEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("actor_id")
    UUID actorId;

    @JsonProperty("actor_role")
    Role actorRole;

    @JsonProperty("action")
    AuditAction action;

    @JsonProperty("entity_type")
    AuditEntityType entityType;

    @JsonProperty("entity_id")
    UUID entityId;

    @JsonProperty("metadata")
    Map<String, Object> metadata;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AuditEntryResponse from(AuditEntry entry) {
        return AuditEntryResponse.builder()
            .id(entry.getId())
            .actorId(entry.getActorId())
            .actorRole(entry.getActorRole())
            .action(entry.getAction())
            .entityType(entry.getEntityType())
            .entityId(entry.getEntityId())
            .metadata(entry.getMetadata())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}

package com.flagship.inventory_ledger.audit;

import com.flagship.inventory_ledger.audit.dto.AuditEntryResponse;
import com.flagship.inventory_ledger.common.Actor;
import com.flagship.inventory_ledger.common.PageRequests;
import com.flagship.inventory_ledger.common.PageResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/audit-logs")
@RequiredArgsConstructor
public class AuditController {

    private final AuditTrail auditTrail;

    @GetMapping
    public PageResponse<AuditEntryResponse> listEntries(
            @RequestParam(value = "actor_id", required = false) UUID actorId,
            @RequestParam(value = "action", required = false) AuditAction action,
            @RequestParam(value = "entity_type", required = false) AuditEntityType entityType,
            @RequestParam(value = "entity_id", required = false) UUID entityId,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "size", defaultValue = "" + PageRequests.DEFAULT_SIZE) int size,
            Actor actor) {

        AuditQuery query = AuditQuery.builder()
            .actorId(actorId)
            .action(action)
            .entityType(entityType)
            .entityId(entityId)
            .from(from)
            .to(to)
            .build();
        return auditTrail.query(query, page, size, actor).map(AuditEntryResponse::from);
    }

    @GetMapping("/{entityType}/{entityId}")
    public List<AuditEntryResponse> entityHistory(@PathVariable("entityType") AuditEntityType entityType,
                                                  @PathVariable("entityId") UUID entityId,
                                                  Actor actor) {
        return auditTrail.historyOf(entityType, entityId, actor).stream()
            .map(AuditEntryResponse::from)
            .toList();
    }
}

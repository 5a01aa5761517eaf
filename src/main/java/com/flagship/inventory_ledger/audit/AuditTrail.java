package com.flagship.inventory_ledger.audit;

import com.flagship.inventory_ledger.common.AccessPolicy;
import com.flagship.inventory_ledger.common.Actor;
import com.flagship.inventory_ledger.common.PageRequests;
import com.flagship.inventory_ledger.common.PageResponse;
import com.flagship.inventory_ledger.common.Permission;
import com.flagship.inventory_ledger.common.Role;
import com.flagship.inventory_ledger.observability.InventoryMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only record of who did what.
 *
 * {@link #append} never throws: it writes in its own transaction and a failure
 * is logged and counted, leaving the caller's committed work alone.
 */
@Service
@Slf4j
public class AuditTrail {

    private final AuditEntryRepository auditEntryRepository;
    private final TransactionTemplate appendTransaction;
    private final InventoryMetrics metrics;
    private final ZoneId organizationZone;

    public AuditTrail(AuditEntryRepository auditEntryRepository,
                      PlatformTransactionManager transactionManager,
                      InventoryMetrics metrics,
                      ZoneId organizationZone) {
        this.auditEntryRepository = auditEntryRepository;
        this.appendTransaction = new TransactionTemplate(transactionManager);
        this.appendTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.metrics = metrics;
        this.organizationZone = organizationZone;
    }

    /**
     * @return the stored entry, or empty if it could not be written
     */
    public Optional<AuditEntry> append(UUID actorId, Role actorRole, AuditAction action,
                                       AuditEntityType entityType, UUID entityId, Map<String, Object> metadata) {
        try {
            AuditEntry entry = appendTransaction.execute(status ->
                auditEntryRepository.saveAndFlush(
                    AuditEntryEntity.create(actorId, actorRole, action, entityType, entityId, metadata)
                ).toDomain());
            log.debug("Audit entry appended: action={}, entityType={}, entityId={}", action, entityType, entityId);
            return Optional.ofNullable(entry);
        } catch (Exception e) {
            metrics.recordAuditAppendFailure();
            log.error("Failed to append audit entry: action={}, entityType={}, entityId={}, error={}",
                    action, entityType, entityId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    @Transactional(readOnly = true)
    public PageResponse<AuditEntry> query(AuditQuery query, int page, int size, Actor actor) {
        AccessPolicy.require(actor, Permission.READ_AUDIT_LOG);
        AuditQuery effective = query != null ? query : AuditQuery.builder().build();
        return PageResponse.from(
            auditEntryRepository.findAll(AuditSpecifications.matching(effective, organizationZone),
                    PageRequests.newestFirst(page, size, "createdAt")),
            AuditEntryEntity::toDomain);
    }

    /**
     * Full history of one entity, oldest first.
     */
    @Transactional(readOnly = true)
    public List<AuditEntry> historyOf(AuditEntityType entityType, UUID entityId, Actor actor) {
        AccessPolicy.require(actor, Permission.READ_AUDIT_LOG);
        return auditEntryRepository.findByEntityTypeAndEntityIdOrderByCreatedAtAsc(entityType, entityId)
            .stream()
            .map(AuditEntryEntity::toDomain)
            .toList();
    }
}

package com.flagship.inventory_ledger.audit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AuditEntryRepository extends JpaRepository<AuditEntryEntity, UUID>,
        JpaSpecificationExecutor<AuditEntryEntity> {

    List<AuditEntryEntity> findByEntityTypeAndEntityIdOrderByCreatedAtAsc(AuditEntityType entityType, UUID entityId);
}

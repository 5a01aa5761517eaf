package com.flagship.inventory_ledger.purchase;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PurchaseRepository extends JpaRepository<PurchaseEntity, UUID>,
        JpaSpecificationExecutor<PurchaseEntity> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PurchaseEntity p WHERE p.id = :id")
    Optional<PurchaseEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<PurchaseEntity> findByIdempotencyKey(String idempotencyKey);

    @Query("SELECT DISTINCT p.supplier FROM PurchaseEntity p ORDER BY p.supplier")
    List<String> findDistinctSuppliers();
}

package com.flagship.inventory_ledger.user;

import com.flagship.inventory_ledger.common.Role;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AppUserRepository extends JpaRepository<AppUserEntity, UUID> {

    @Query("SELECT u.id FROM AppUserEntity u WHERE u.active = true AND u.role = :role ORDER BY u.createdAt")
    List<UUID> findActiveIdsByRole(@Param("role") Role role);

    @Query("SELECT u.id FROM AppUserEntity u WHERE u.active = true ORDER BY u.createdAt")
    List<UUID> findActiveIds();

    @Query("SELECT u.fullName FROM AppUserEntity u WHERE u.id = :id")
    Optional<String> findFullNameById(@Param("id") UUID id);
}

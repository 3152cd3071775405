package com.flagship.fiscal_ledger.account;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AccountRepository extends JpaRepository<AccountEntity, UUID> {

    Optional<AccountEntity> findByIdAndTenantId(UUID id, UUID tenantId);

    Optional<AccountEntity> findByTenantIdAndCode(UUID tenantId, String code);

    List<AccountEntity> findByTenantIdOrderByCodeAsc(UUID tenantId);

    boolean existsByIdAndTenantId(UUID id, UUID tenantId);

    /**
     * Ids from the given set that exist for the tenant.
     */
    @Query("SELECT a.id FROM AccountEntity a WHERE a.tenantId = :tenantId AND a.id IN :ids")
    List<UUID> findExistingIds(@Param("tenantId") UUID tenantId, @Param("ids") Collection<UUID> ids);
}

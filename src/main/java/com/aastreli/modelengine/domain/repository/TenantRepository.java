package com.aastreli.modelengine.domain.repository;

import com.aastreli.modelengine.domain.model.Tenant;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface TenantRepository extends JpaRepository<Tenant, UUID> {

    Optional<Tenant> findFirstByTenantCodeAndDeletedFalse(String tenantCode);
}

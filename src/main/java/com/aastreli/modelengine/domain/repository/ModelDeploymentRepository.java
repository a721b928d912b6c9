package com.aastreli.modelengine.domain.repository;

import com.aastreli.modelengine.domain.model.ModelDeployment;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ModelDeploymentRepository extends JpaRepository<ModelDeployment, UUID> {

    List<ModelDeployment> findByProductionTrueAndDeploymentEndIsNull();

    List<ModelDeployment> findByTenantIdAndModelIdAndProductionTrueAndDeploymentEndIsNull(UUID tenantId, UUID modelId);

    long countByTenantIdAndModelIdAndProductionTrueAndDeploymentEndIsNull(UUID tenantId, UUID modelId);
}

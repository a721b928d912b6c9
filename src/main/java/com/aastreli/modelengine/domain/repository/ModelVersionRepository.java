package com.aastreli.modelengine.domain.repository;

import com.aastreli.modelengine.domain.model.ModelVersion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ModelVersionRepository extends JpaRepository<ModelVersion, UUID> {

    Optional<ModelVersion> findByIdAndDeletedFalse(UUID id);

    List<ModelVersion> findByIdIn(Collection<UUID> ids);

    long countByTenantIdAndModelId(UUID tenantId, UUID modelId);

    @Query("SELECT v.artifactPath FROM ModelVersion v WHERE v.id = :id AND v.deleted = false")
    Optional<String> findArtifactPath(@Param("id") UUID id);
}

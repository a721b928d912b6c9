package com.aastreli.modelengine.domain.repository;

import com.aastreli.modelengine.domain.model.AssetModelBinding;
import com.aastreli.modelengine.domain.model.ModelBinding;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.UUID;

public interface AssetModelBindingRepository extends JpaRepository<AssetModelBinding, UUID> {

    @Query("SELECT new com.aastreli.modelengine.domain.model.ModelBinding(" +
            "b.assetId, b.modelId, b.modelVersionId, v.fullVersionLabel, v.artifactPath) " +
            "FROM AssetModelBinding b JOIN ModelVersion v ON v.id = b.modelVersionId " +
            "WHERE b.active = true AND v.deleted = false")
    List<ModelBinding> findActiveBindings();
}

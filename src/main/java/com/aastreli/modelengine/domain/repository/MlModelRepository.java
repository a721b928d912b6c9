package com.aastreli.modelengine.domain.repository;

import com.aastreli.modelengine.domain.model.MlModel;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

public interface MlModelRepository extends JpaRepository<MlModel, UUID> {

    Optional<MlModel> findFirstByTenantIdAndModelNameAndDeletedFalse(UUID tenantId, String modelName);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM MlModel m WHERE m.id = :id")
    Optional<MlModel> lockById(@Param("id") UUID id);
}

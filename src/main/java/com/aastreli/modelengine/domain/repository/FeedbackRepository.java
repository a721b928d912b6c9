package com.aastreli.modelengine.domain.repository;

import com.aastreli.modelengine.domain.model.FeedbackRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface FeedbackRepository extends JpaRepository<FeedbackRecord, UUID> {

    long countByTenantId(UUID tenantId);

    @Query("SELECT f.feedbackType, COUNT(f) FROM FeedbackRecord f " +
            "WHERE (:tenantId IS NULL OR f.tenantId = :tenantId) " +
            "GROUP BY f.feedbackType")
    List<Object[]> countGroupedByType(@Param("tenantId") UUID tenantId);

    List<FeedbackRecord> findByTenantIdOrderByCreatedAtAsc(UUID tenantId);

    List<FeedbackRecord> findAllByOrderByCreatedAtAsc();

    List<FeedbackRecord> findByIdInOrderByCreatedAtAsc(Collection<UUID> ids);

    List<FeedbackRecord> findByTenantIdAndIdInOrderByCreatedAtAsc(UUID tenantId, Collection<UUID> ids);

}

package com.aastreli.modelengine.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "ml_model_deployments", indexes = {
        @Index(name = "idx_ml_model_deployments_open", columnList = "tenant_id, model_id, is_production, deployment_end")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelDeployment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "model_id", nullable = false)
    private UUID modelId;

    @Column(name = "model_version_id", nullable = false)
    private UUID modelVersionId;

    @Column(name = "is_production", nullable = false)
    private boolean production;

    @Column(name = "deployment_start", nullable = false)
    private Instant deploymentStart;

    /** Null while the deployment is active. */
    @Column(name = "deployment_end")
    private Instant deploymentEnd;

    @Column(name = "rollback_from_version_id")
    private UUID rollbackFromVersionId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public boolean isOpen() {
        return deploymentEnd == null;
    }
}

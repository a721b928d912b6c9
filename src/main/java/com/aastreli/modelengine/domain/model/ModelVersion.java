package com.aastreli.modelengine.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * One trained, immutable artifact bundle plus its evaluation metrics.
 * Only the stage changes after creation, and only through a deployment.
 */
@Entity
@Table(name = "ml_model_versions",
        uniqueConstraints = @UniqueConstraint(name = "uq_ml_model_versions_tenant_label",
                columnNames = {"tenant_id", "full_version_label"}),
        indexes = @Index(name = "idx_ml_model_versions_tenant_model", columnList = "tenant_id, model_id"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelVersion {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "model_id", nullable = false)
    private UUID modelId;

    @Column(name = "semantic_version", nullable = false, length = 50)
    private String semanticVersion;

    @Column(name = "full_version_label", nullable = false)
    private String fullVersionLabel;

    @Builder.Default
    @Convert(converter = ModelStage.Converter.class)
    @Column(name = "stage", nullable = false, length = 50)
    private ModelStage stage = ModelStage.STAGING;

    @Column(name = "model_artifact_path", nullable = false, length = 1024)
    private String artifactPath;

    @Column(name = "training_start")
    private Instant trainingStart;

    @Column(name = "training_end")
    private Instant trainingEnd;

    @Column(name = "accuracy")
    private Double accuracy;

    @Column(name = "precision_score")
    private Double precisionScore;

    @Column(name = "recall_score")
    private Double recallScore;

    @Column(name = "f1_score")
    private Double f1Score;

    @Column(name = "false_alarm_rate")
    private Double falseAlarmRate;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Builder.Default
    @Column(name = "is_deleted", nullable = false)
    private boolean deleted = false;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}

package com.aastreli.modelengine.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
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
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "feedback", indexes = {
        @Index(name = "idx_feedback_tenant", columnList = "tenant_id"),
        @Index(name = "idx_feedback_created_at", columnList = "created_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "asset_id")
    private UUID assetId;

    @Column(name = "sensor_id")
    private UUID sensorId;

    @Column(name = "prediction_id", length = 100)
    private String predictionId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload_normalized")
    private List<Double> features;

    @Column(name = "prediction_label", nullable = false)
    private String predictionLabel;

    @Column(name = "probability")
    private Double probability;

    @Column(name = "new_label", nullable = false)
    private String newLabel;

    @Column(name = "correction", length = 4000)
    private String correction;

    @Convert(converter = FeedbackType.Converter.class)
    @Column(name = "feedback_type", nullable = false, length = 50)
    private FeedbackType feedbackType;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "created_by")
    private UUID createdBy;
}

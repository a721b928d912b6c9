package com.aastreli.modelengine.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Asset to model-version association. Owned by the site-setup side; read-only here.
 */
@Entity
@Table(name = "asset_model_versions")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssetModelBinding {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "asset_id", nullable = false)
    private UUID assetId;

    @Column(name = "model_id", nullable = false)
    private UUID modelId;

    @Column(name = "model_version_id", nullable = false)
    private UUID modelVersionId;

    @Builder.Default
    @Column(name = "stage", nullable = false, length = 50)
    private String stage = "production";

    @Column(name = "deployment_start", nullable = false)
    private Instant deploymentStart;

    @Column(name = "deployment_end")
    private Instant deploymentEnd;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean active = true;
}

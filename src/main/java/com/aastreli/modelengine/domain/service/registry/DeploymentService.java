package com.aastreli.modelengine.domain.service.registry;

import com.aastreli.modelengine.domain.exception.ModelVersionNotFoundException;
import com.aastreli.modelengine.domain.model.ModelDeployment;
import com.aastreli.modelengine.domain.model.ModelStage;
import com.aastreli.modelengine.domain.model.ModelVersion;
import com.aastreli.modelengine.domain.repository.MlModelRepository;
import com.aastreli.modelengine.domain.repository.ModelDeploymentRepository;
import com.aastreli.modelengine.domain.repository.ModelVersionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Writes deployment records. Production deployments of one (tenant, model) are serialised on the
 * {@code ml_models} row lock, so at most one stays open.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeploymentService {

    private final ModelVersionRepository versionRepository;
    private final ModelDeploymentRepository deploymentRepository;
    private final MlModelRepository modelRepository;

    @Transactional
    public DeploymentResult deploy(UUID versionId, boolean production) {
        ModelVersion version = versionRepository.findByIdAndDeletedFalse(versionId)
                .orElseThrow(() -> new ModelVersionNotFoundException(versionId.toString()));

        Instant now = Instant.now();
        UUID rollbackFrom = null;

        if (production) {
            modelRepository.lockById(version.getModelId());

            List<ModelDeployment> open = deploymentRepository
                    .findByTenantIdAndModelIdAndProductionTrueAndDeploymentEndIsNull(
                            version.getTenantId(), version.getModelId());

            ModelDeployment previous = null;
            for (ModelDeployment d : open) {
                if (previous == null || d.getDeploymentStart().isAfter(previous.getDeploymentStart())) {
                    previous = d;
                }
                d.setDeploymentEnd(now);
                d.setProduction(false);
            }
            deploymentRepository.saveAllAndFlush(open);

            if (previous != null && !previous.getModelVersionId().equals(versionId)) {
                rollbackFrom = previous.getModelVersionId();
                versionRepository.findById(rollbackFrom).ifPresent(v -> v.setStage(ModelStage.ARCHIVED));
            }
            version.setStage(ModelStage.PRODUCTION);
        }

        ModelDeployment deployment = deploymentRepository.save(ModelDeployment.builder()
                .tenantId(version.getTenantId())
                .modelId(version.getModelId())
                .modelVersionId(version.getId())
                .production(production)
                .deploymentStart(now)
                .rollbackFromVersionId(rollbackFrom)
                .build());

        log.info("[Deploy] 배포 기록 생성: version={}, tenant={}, production={}, rollbackFrom={}",
                version.getFullVersionLabel(), version.getTenantId(), production, rollbackFrom);

        return new DeploymentResult(
                deployment.getId(),
                production,
                version.getTenantId(),
                version.getId(),
                version.getFullVersionLabel(),
                version.getArtifactPath(),
                rollbackFrom);
    }
}

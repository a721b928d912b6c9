package com.aastreli.modelengine.domain.service.registry;

import java.util.UUID;

public record DeploymentResult(
        UUID deploymentId,
        boolean production,
        UUID tenantId,
        UUID versionId,
        String versionLabel,
        String artifactPath,
        UUID rollbackFromVersionId
) {
}

package com.aastreli.modelengine.domain.service;

import com.aastreli.modelengine.domain.model.MlModel;
import com.aastreli.modelengine.domain.model.Tenant;
import com.aastreli.modelengine.domain.repository.MlModelRepository;
import com.aastreli.modelengine.domain.repository.TenantRepository;
import com.aastreli.modelengine.domain.service.registry.ModelRegistryProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * Single-tenant mode: callers that omit a tenant or model get the {@code default} tenant and
 * its {@code model.registry.default-model-name} model.
 */
@Component
@RequiredArgsConstructor
public class TenantModelResolver {

    static final String DEFAULT_TENANT_CODE = "default";

    private final TenantRepository tenantRepository;
    private final MlModelRepository modelRepository;
    private final ModelRegistryProperties registryProperties;

    public Optional<UUID> resolveTenant(UUID tenantId) {
        if (tenantId != null) {
            return Optional.of(tenantId);
        }
        return tenantRepository.findFirstByTenantCodeAndDeletedFalse(DEFAULT_TENANT_CODE)
                .map(Tenant::getId);
    }

    public Optional<UUID> resolveModel(UUID tenantId, UUID modelId) {
        if (modelId != null) {
            return Optional.of(modelId);
        }
        if (tenantId == null) {
            return Optional.empty();
        }
        return modelRepository.findFirstByTenantIdAndModelNameAndDeletedFalse(tenantId,
                        registryProperties.getDefaultModelName())
                .map(MlModel::getId);
    }

    public String modelName(UUID modelId) {
        if (modelId == null) {
            return registryProperties.getDefaultModelName();
        }
        return modelRepository.findById(modelId)
                .map(MlModel::getModelName)
                .orElse(registryProperties.getDefaultModelName());
    }
}

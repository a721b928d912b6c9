package com.aastreli.modelengine.infra.monitor;

import com.aastreli.modelengine.domain.service.registry.ModelRegistry;
import com.aastreli.modelengine.infra.ingestion.ModelBindingCache;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ModelRegistryHealthIndicator implements HealthIndicator {

    private final ModelRegistry modelRegistry;
    private final ModelBindingCache bindingCache;

    @Override
    public Health health() {
        Health.Builder builder = modelRegistry.isReady() ? Health.up() : Health.down();
        return builder
                .withDetail("modelVersion", modelRegistry.currentVersionLabel())
                .withDetail("loadedVersions", modelRegistry.loadedCount())
                .withDetail("tenantDefaults", modelRegistry.snapshot().tenantDefaults().size())
                .withDetail("bindings", bindingCache.size())
                .build();
    }
}

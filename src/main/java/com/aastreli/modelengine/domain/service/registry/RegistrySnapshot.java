package com.aastreli.modelengine.domain.service.registry;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Tenant to production version, and version to artifact location. Never mutated; replaced whole.
 */
public record RegistrySnapshot(Map<UUID, UUID> tenantDefaults, Map<UUID, String> versionPaths) {

    public static final RegistrySnapshot EMPTY = new RegistrySnapshot(Map.of(), Map.of());

    public RegistrySnapshot {
        tenantDefaults = Map.copyOf(tenantDefaults);
        versionPaths = Map.copyOf(versionPaths);
    }

    public RegistrySnapshot withDefault(UUID tenantId, UUID versionId, String artifactPath) {
        Map<UUID, UUID> defaults = new HashMap<>(tenantDefaults);
        defaults.put(tenantId, versionId);
        Map<UUID, String> paths = new HashMap<>(versionPaths);
        paths.put(versionId, artifactPath);
        return new RegistrySnapshot(defaults, paths);
    }

    public UUID defaultFor(UUID tenantId) {
        return tenantId == null ? null : tenantDefaults.get(tenantId);
    }

    public String pathOf(UUID versionId) {
        return versionId == null ? null : versionPaths.get(versionId);
    }
}

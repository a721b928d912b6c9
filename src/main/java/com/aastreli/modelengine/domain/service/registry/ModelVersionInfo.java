package com.aastreli.modelengine.domain.service.registry;

import java.util.Map;

public record ModelVersionInfo(
        String version,
        String createdAt,
        Integer numClasses,
        Map<String, Object> metrics,
        Integer trainingSamples,
        Integer feedbackSamples,
        boolean active
) {

    @SuppressWarnings("unchecked")
    static ModelVersionInfo fromMetadata(Map<String, Object> metadata, boolean active) {
        Object metrics = metadata.get("metrics");
        return new ModelVersionInfo(
                metadata.get("version") != null ? metadata.get("version").toString() : null,
                metadata.get("createdAt") != null ? metadata.get("createdAt").toString() : null,
                asInteger(metadata.get("numClasses")),
                metrics instanceof Map ? (Map<String, Object>) metrics : null,
                asInteger(metadata.get("trainingSamples")),
                asInteger(metadata.get("feedbackSamples")),
                active);
    }

    private static Integer asInteger(Object value) {
        return value instanceof Number n ? n.intValue() : null;
    }
}

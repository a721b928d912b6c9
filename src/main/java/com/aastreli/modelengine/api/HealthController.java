package com.aastreli.modelengine.api;

import com.aastreli.modelengine.domain.service.registry.ModelRegistry;
import com.aastreli.modelengine.infra.ingestion.ModelBindingCache;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

@RestController
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class HealthController {

    private final ModelRegistry modelRegistry;
    private final ModelBindingCache bindingCache;

    @Value("${spring.application.name:model-lifecycle-engine}")
    private String serviceName;

    @Value("${info.app.version:0.1.0}")
    private String serviceVersion;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean ready = modelRegistry.isReady();
        return ResponseEntity.ok(Map.of(
                "status", ready ? "healthy" : "degraded",
                "service", serviceName,
                "version", serviceVersion,
                "modelVersion", modelRegistry.currentVersionLabel(),
                "timestamp", Instant.now().toString(),
                "details", Map.of(
                        "modelLoaded", ready,
                        "loadedVersions", modelRegistry.loadedCount(),
                        "tenantDefaults", modelRegistry.snapshot().tenantDefaults().size(),
                        "bindings", bindingCache.size()
                )
        ));
    }
}

package com.aastreli.modelengine.api;

import com.aastreli.modelengine.domain.exception.ModelVersionNotFoundException;
import com.aastreli.modelengine.domain.service.registry.DeploymentResult;
import com.aastreli.modelengine.domain.service.registry.ModelRegistry;
import com.aastreli.modelengine.domain.service.registry.ModelVersionInfo;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class ModelController {

    private final ModelRegistry modelRegistry;

    @GetMapping("/models")
    public ResponseEntity<List<ModelVersionInfo>> listModels() {
        return ResponseEntity.ok(modelRegistry.listVersions());
    }

    @GetMapping("/models/{version}")
    public ResponseEntity<ModelVersionInfo> getModel(@PathVariable String version) {
        return modelRegistry.versionInfo(version)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ModelVersionNotFoundException(version));
    }

    @PostMapping("/models/{version}/activate")
    public ResponseEntity<Map<String, Object>> activate(@PathVariable String version) {
        String current = modelRegistry.activate(version);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "Activated model version " + version,
                "currentVersion", current
        ));
    }

    @PostMapping("/models/versions/{versionId}/deploy")
    public ResponseEntity<Map<String, Object>> deploy(@PathVariable UUID versionId,
                                                      @RequestBody(required = false) DeployRequest req) {
        boolean production = req == null || req.isProduction() == null || req.isProduction();
        DeploymentResult result = modelRegistry.deploy(versionId, production);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", "Deployed " + result.versionLabel());
        body.put("deploymentId", result.deploymentId().toString());
        body.put("isProduction", result.production());
        body.put("rollbackFromVersionId",
                result.rollbackFromVersionId() != null ? result.rollbackFromVersionId().toString() : null);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/metrics")
    public ResponseEntity<Map<String, Object>> metrics() {
        return ResponseEntity.ok(modelRegistry.metrics());
    }

    public record DeployRequest(
            @JsonProperty("isProduction") @JsonAlias("is_production") Boolean isProduction
    ) {
    }
}

package com.aastreli.modelengine.api;

import com.aastreli.modelengine.domain.service.retraining.RetrainResult;
import com.aastreli.modelengine.domain.service.retraining.RetrainingPipeline;
import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@RestController
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class RetrainController {

    private final RetrainingPipeline retrainingPipeline;

    @PostMapping("/retrain")
    public ResponseEntity<Map<String, Object>> retrain(@RequestBody(required = false) RetrainRequest req) {
        RetrainRequest request = req != null ? req : new RetrainRequest(null, false, null, null);
        UUID tenantId = parseUuid(request.tenantId(), "tenantId");
        UUID modelId = parseUuid(request.modelId(), "modelId");
        List<UUID> feedbackIds = request.selectedFeedbackIds() == null ? null
                : request.selectedFeedbackIds().stream().map(id -> parseUuid(id, "selectedFeedbackIds")).toList();
        boolean async = Boolean.TRUE.equals(request.asyncMode());

        log.info("[Retrain] 재학습 요청: tenant={}, model={}, selected={}, async={}",
                tenantId, modelId, feedbackIds == null ? "all" : feedbackIds.size(), async);

        RetrainResult result = async
                ? retrainingPipeline.retrainAsync(tenantId, modelId, feedbackIds)
                : retrainingPipeline.retrain(tenantId, modelId, feedbackIds);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", result.success());
        body.put("status", result.status().getCode());
        body.put("message", result.message());
        body.put("newVersionLabel", result.newVersionLabel());
        body.put("newVersionId", result.newVersionId() != null ? result.newVersionId().toString() : null);
        body.put("metrics", result.metrics());
        body.put("feedbackCount", result.feedbackCount());
        body.put("asyncMode", async);
        return ResponseEntity.ok(body);
    }

    private static UUID parseUuid(String value, String field) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(field + " is not a valid UUID: " + value);
        }
    }

    public record RetrainRequest(
            @JsonAlias("selected_data_ids") List<String> selectedFeedbackIds,
            @JsonAlias("async_mode") Boolean asyncMode,
            @JsonAlias("tenant_id") String tenantId,
            @JsonAlias("model_id") String modelId
    ) {
    }
}

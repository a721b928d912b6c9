package com.aastreli.modelengine.api;

import com.aastreli.modelengine.api.dto.PredictRequest;
import com.aastreli.modelengine.api.dto.PredictionResponse;
import com.aastreli.modelengine.domain.service.registry.ModelRegistry;
import com.aastreli.modelengine.domain.service.registry.PredictionResult;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Valid;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@RestController
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class PredictionController {

    private final ModelRegistry modelRegistry;
    private final Validator validator;

    @PostMapping("/predict")
    public ResponseEntity<PredictionResponse> predict(@Valid @RequestBody PredictRequest req) {
        return ResponseEntity.ok(doPredict(req));
    }

    @PostMapping("/predict-batch")
    public ResponseEntity<List<PredictionResponse>> predictBatch(@RequestBody List<PredictRequest> requests) {
        Set<ConstraintViolation<PredictRequest>> violations = new HashSet<>();
        for (PredictRequest req : requests) {
            violations.addAll(validator.validate(req));
        }
        if (!violations.isEmpty()) {
            throw new ConstraintViolationException(violations);
        }

        List<PredictionResponse> responses = new ArrayList<>(requests.size());
        for (PredictRequest req : requests) {
            responses.add(doPredict(req));
        }
        return ResponseEntity.ok(responses);
    }

    private PredictionResponse doPredict(PredictRequest req) {
        PredictionResult result = modelRegistry.predict(
                req.featureArray(),
                req.topKOrDefault(),
                req.modelVersionId(),
                RequestIds.parseOrNull(req.tenantId()));
        log.debug("[Predict] tenant={}, asset={}, label={}, version={}",
                req.tenantId(), req.assetId(), result.label(), result.resolvedVersionLabel());
        return PredictionResponse.of(result, req.requestId());
    }
}

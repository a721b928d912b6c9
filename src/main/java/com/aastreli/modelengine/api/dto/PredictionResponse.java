package com.aastreli.modelengine.api.dto;

import com.aastreli.modelengine.domain.service.registry.LabelScore;
import com.aastreli.modelengine.domain.service.registry.PredictionResult;

import java.time.Instant;
import java.util.List;

public record PredictionResponse(
        String prediction,
        double confidence,
        List<LabelScore> topPredictions,
        String modelVersion,
        String modelVersionId,
        Instant timestamp,
        String requestId
) {

    public static PredictionResponse of(PredictionResult result, String requestId) {
        return new PredictionResponse(
                result.label(),
                result.confidence(),
                result.topPredictions(),
                result.resolvedVersionLabel(),
                result.resolvedVersionId() != null ? result.resolvedVersionId().toString() : null,
                Instant.now(),
                requestId);
    }
}

package com.aastreli.modelengine.domain.service.registry;

import java.util.List;
import java.util.UUID;

/**
 * @param resolvedVersionId null when the filesystem fallback model answered
 */
public record PredictionResult(
        String label,
        double confidence,
        List<LabelScore> topPredictions,
        UUID resolvedVersionId,
        String resolvedVersionLabel
) {
}

package com.aastreli.modelengine.domain.service.feedback;

import com.aastreli.modelengine.domain.model.FeedbackType;

import java.util.List;
import java.util.UUID;

public record FeedbackSubmission(
        List<Double> features,
        String originalPrediction,
        String correctedLabel,
        FeedbackType feedbackType,
        Double confidence,
        String notes,
        UUID tenantId,
        UUID assetId,
        UUID sensorId,
        String predictionId
) {
}

package com.aastreli.modelengine.domain.service.retraining;

import java.util.Map;
import java.util.UUID;

public record RetrainResult(
        boolean success,
        RetrainStatus status,
        String message,
        String newVersionLabel,
        UUID newVersionId,
        Map<String, Double> metrics,
        long feedbackCount
) {

    static RetrainResult failure(RetrainStatus status, String message, long feedbackCount) {
        return new RetrainResult(false, status, message, null, null, null, feedbackCount);
    }

    static RetrainResult started(long feedbackCount) {
        return new RetrainResult(true, RetrainStatus.STARTED, "Retraining started in background",
                null, null, null, feedbackCount);
    }
}

package com.aastreli.modelengine.domain.service.feedback;

public record FeedbackStats(
        long total,
        long correct,
        long corrections,
        long newFaults,
        long falsePositives
) {
}

package com.aastreli.modelengine.domain.service.feedback;

import com.aastreli.modelengine.domain.classifier.TrainingDataset;

import java.util.List;
import java.util.UUID;

public record FeedbackDataset(double[][] features, List<String> labels, List<UUID> ids) {

    public int count() {
        return labels.size();
    }

    public TrainingDataset toTrainingDataset() {
        return new TrainingDataset(features, labels);
    }
}

package com.aastreli.modelengine.domain.classifier;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Raw (unscaled) samples with their string labels.
 */
public record TrainingDataset(double[][] features, List<String> labels) {

    public TrainingDataset {
        if (features.length != labels.size()) {
            throw new IllegalArgumentException("features/labels size mismatch");
        }
        labels = List.copyOf(labels);
    }

    public int size() {
        return labels.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return labels.isEmpty();
    }
}

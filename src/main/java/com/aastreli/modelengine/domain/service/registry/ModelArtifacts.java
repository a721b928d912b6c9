package com.aastreli.modelengine.domain.service.registry;

import java.util.List;

public final class ModelArtifacts {

    public static final String CLASSIFIER = "classifier.json";
    public static final String LABEL_ENCODER = "label_encoder.json";
    public static final String FEATURE_SCALER = "feature_scaler.json";
    public static final String METADATA = "metadata.json";
    public static final String TRAINING_DATA = "training_data.json";
    public static final String TRAINING_DATA_CSV = "training_data.csv";

    public static final List<String> BUNDLE = List.of(
            CLASSIFIER, LABEL_ENCODER, FEATURE_SCALER, METADATA, TRAINING_DATA);

    private ModelArtifacts() {
    }
}

package com.aastreli.modelengine.domain.service.registry;

import com.aastreli.modelengine.domain.classifier.Classifier;
import com.aastreli.modelengine.domain.classifier.FeatureScaler;
import com.aastreli.modelengine.domain.classifier.LabelEncoder;
import lombok.Getter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A loaded, immutable model bundle. Safe to share between request threads.
 */
@Getter
public class ModelHandle {

    private final Classifier classifier;
    private final LabelEncoder encoder;
    private final FeatureScaler scaler;
    private final Map<String, Object> metadata;
    private final Map<String, Path> files;

    public ModelHandle(Classifier classifier, LabelEncoder encoder, FeatureScaler scaler,
                       Map<String, Object> metadata, Map<String, Path> files) {
        if (classifier.numClasses() != encoder.size()) {
            throw new IllegalArgumentException("Classifier has " + classifier.numClasses()
                    + " classes but encoder has " + encoder.size());
        }
        if (classifier.numFeatures() != scaler.dimension()) {
            throw new IllegalArgumentException("Classifier expects " + classifier.numFeatures()
                    + " features but scaler has " + scaler.dimension());
        }
        this.classifier = classifier;
        this.encoder = encoder;
        this.scaler = scaler;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.files = Map.copyOf(files);
    }

    public String version() {
        Object version = metadata.get("version");
        return version != null ? version.toString() : "unknown";
    }

    public int numFeatures() {
        return scaler.dimension();
    }

    public PredictionResult predict(double[] features, int topK) {
        double[] proba = classifier.predictProba(scaler.transform(features));

        List<Integer> order = new ArrayList<>(proba.length);
        for (int i = 0; i < proba.length; i++) order.add(i);
        order.sort(Comparator.comparingDouble((Integer i) -> proba[i]).reversed());

        int k = Math.max(1, Math.min(topK, proba.length));
        List<LabelScore> top = new ArrayList<>(k);
        for (int i = 0; i < k; i++) {
            int idx = order.get(i);
            top.add(new LabelScore(encoder.decode(idx), proba[idx]));
        }
        LabelScore best = top.get(0);
        return new PredictionResult(best.label(), best.confidence(), List.copyOf(top), null, version());
    }
}

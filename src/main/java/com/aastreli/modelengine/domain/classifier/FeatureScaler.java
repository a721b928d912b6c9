package com.aastreli.modelengine.domain.classifier;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

@Getter
public final class FeatureScaler {

    private final double[] mean;
    private final double[] scale;

    @JsonCreator
    public FeatureScaler(@JsonProperty("mean") double[] mean, @JsonProperty("scale") double[] scale) {
        if (mean.length != scale.length) {
            throw new IllegalArgumentException("mean/scale length mismatch");
        }
        this.mean = mean;
        this.scale = scale;
    }

    public static FeatureScaler fit(double[][] samples) {
        if (samples.length == 0) {
            throw new IllegalArgumentException("No samples to fit scaler");
        }
        int n = samples.length;
        int d = samples[0].length;
        double[] mean = new double[d];
        double[] scale = new double[d];
        for (double[] row : samples) {
            for (int j = 0; j < d; j++) mean[j] += row[j];
        }
        for (int j = 0; j < d; j++) mean[j] /= n;
        for (double[] row : samples) {
            for (int j = 0; j < d; j++) {
                double diff = row[j] - mean[j];
                scale[j] += diff * diff;
            }
        }
        for (int j = 0; j < d; j++) {
            double std = Math.sqrt(scale[j] / n);
            scale[j] = std == 0.0 ? 1.0 : std;
        }
        return new FeatureScaler(mean, scale);
    }

    public int dimension() {
        return mean.length;
    }

    public double[] transform(double[] features) {
        if (features.length != mean.length) {
            throw new IllegalArgumentException(
                    "Expected " + mean.length + " features but got " + features.length);
        }
        double[] out = new double[features.length];
        for (int j = 0; j < features.length; j++) {
            out[j] = (features[j] - mean[j]) / scale[j];
        }
        return out;
    }

    public double[][] transform(double[][] samples) {
        double[][] out = new double[samples.length][];
        for (int i = 0; i < samples.length; i++) {
            out[i] = transform(samples[i]);
        }
        return out;
    }
}

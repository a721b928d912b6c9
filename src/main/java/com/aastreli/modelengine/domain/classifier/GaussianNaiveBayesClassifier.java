package com.aastreli.modelengine.domain.classifier;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

@Getter
public class GaussianNaiveBayesClassifier implements Classifier {

    private final double[] classPrior;
    private final double[][] means;
    private final double[][] variances;

    @JsonCreator
    public GaussianNaiveBayesClassifier(@JsonProperty("classPrior") double[] classPrior,
                                        @JsonProperty("means") double[][] means,
                                        @JsonProperty("variances") double[][] variances) {
        if (classPrior.length != means.length || means.length != variances.length) {
            throw new IllegalArgumentException("class dimension mismatch");
        }
        this.classPrior = classPrior;
        this.means = means;
        this.variances = variances;
    }

    @Override
    public int numFeatures() {
        return means.length == 0 ? 0 : means[0].length;
    }

    @Override
    public int numClasses() {
        return classPrior.length;
    }

    @Override
    public double[] predictProba(double[] features) {
        if (features.length != numFeatures()) {
            throw new IllegalArgumentException(
                    "Expected " + numFeatures() + " features but got " + features.length);
        }
        int k = numClasses();
        double[] jointLog = new double[k];
        double max = Double.NEGATIVE_INFINITY;
        for (int c = 0; c < k; c++) {
            if (classPrior[c] <= 0.0) {
                jointLog[c] = Double.NEGATIVE_INFINITY;
                continue;
            }
            double sum = Math.log(classPrior[c]);
            for (int j = 0; j < features.length; j++) {
                double var = variances[c][j];
                double diff = features[j] - means[c][j];
                sum -= 0.5 * Math.log(2.0 * Math.PI * var) + diff * diff / (2.0 * var);
            }
            jointLog[c] = sum;
            if (sum > max) max = sum;
        }

        double[] proba = new double[k];
        if (max == Double.NEGATIVE_INFINITY) {
            return proba;
        }
        double total = 0.0;
        for (int c = 0; c < k; c++) {
            proba[c] = Math.exp(jointLog[c] - max);
            total += proba[c];
        }
        for (int c = 0; c < k; c++) {
            proba[c] /= total;
        }
        return proba;
    }
}

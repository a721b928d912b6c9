package com.aastreli.modelengine.domain.classifier;

import org.springframework.stereotype.Component;

/**
 * Weighted Gaussian naive Bayes. Variances get {@code VAR_SMOOTHING} times the largest
 * feature variance added so constant features stay usable.
 */
@Component
public class GaussianNaiveBayesTrainer implements ClassifierTrainer {

    static final double VAR_SMOOTHING = 1e-9;
    static final double MIN_EPSILON = 1e-9;

    @Override
    public Classifier train(double[][] features, int[] labels, double[] sampleWeights, int numClasses) {
        if (features.length == 0) {
            throw new IllegalArgumentException("No training samples");
        }
        if (features.length != labels.length || labels.length != sampleWeights.length) {
            throw new IllegalArgumentException("Sample count mismatch");
        }
        int n = features.length;
        int d = features[0].length;

        double[] classWeight = new double[numClasses];
        double[][] means = new double[numClasses][d];
        double[][] variances = new double[numClasses][d];

        for (int i = 0; i < n; i++) {
            int c = labels[i];
            double w = sampleWeights[i];
            classWeight[c] += w;
            for (int j = 0; j < d; j++) {
                means[c][j] += w * features[i][j];
            }
        }
        for (int c = 0; c < numClasses; c++) {
            if (classWeight[c] <= 0.0) continue;
            for (int j = 0; j < d; j++) {
                means[c][j] /= classWeight[c];
            }
        }
        for (int i = 0; i < n; i++) {
            int c = labels[i];
            double w = sampleWeights[i];
            for (int j = 0; j < d; j++) {
                double diff = features[i][j] - means[c][j];
                variances[c][j] += w * diff * diff;
            }
        }

        double epsilon = Math.max(VAR_SMOOTHING * maxFeatureVariance(features), MIN_EPSILON);
        double totalWeight = 0.0;
        for (int c = 0; c < numClasses; c++) {
            totalWeight += classWeight[c];
        }
        if (totalWeight <= 0.0) {
            throw new IllegalArgumentException("Sample weights sum to zero");
        }

        double[] prior = new double[numClasses];
        for (int c = 0; c < numClasses; c++) {
            prior[c] = classWeight[c] / totalWeight;
            for (int j = 0; j < d; j++) {
                double var = classWeight[c] > 0.0 ? variances[c][j] / classWeight[c] : 1.0;
                variances[c][j] = var + epsilon;
            }
        }
        return new GaussianNaiveBayesClassifier(prior, means, variances);
    }

    private static double maxFeatureVariance(double[][] features) {
        int n = features.length;
        int d = features[0].length;
        double max = 0.0;
        for (int j = 0; j < d; j++) {
            double mean = 0.0;
            for (double[] row : features) mean += row[j];
            mean /= n;
            double var = 0.0;
            for (double[] row : features) {
                double diff = row[j] - mean;
                var += diff * diff;
            }
            max = Math.max(max, var / n);
        }
        return max;
    }
}

package com.aastreli.modelengine.domain.service.retraining;

import java.util.LinkedHashMap;
import java.util.Map;

public final class ClassificationMetrics {

    public static final String ACCURACY = "accuracy";
    public static final String BALANCED_ACCURACY = "balanced_accuracy";
    public static final String F1 = "f1_score";
    public static final String PRECISION = "precision";
    public static final String RECALL = "recall";
    public static final String FALSE_ALARM_RATE = "false_alarm_rate";

    private ClassificationMetrics() {
    }

    /**
     * Precision, recall and F1 are support-weighted averages over the classes present in
     * {@code yTrue}. The false-alarm rate is the share of normal samples predicted as a fault;
     * pass a negative {@code normalClass} when the label space has no normal class.
     */
    public static Map<String, Double> evaluate(int[] yTrue, int[] yPred, int numClasses, int normalClass) {
        if (yTrue.length != yPred.length) {
            throw new IllegalArgumentException("yTrue/yPred length mismatch");
        }
        int n = yTrue.length;
        int[] support = new int[numClasses];
        int[] predicted = new int[numClasses];
        int[] truePositive = new int[numClasses];
        int correct = 0;
        for (int i = 0; i < n; i++) {
            support[yTrue[i]]++;
            predicted[yPred[i]]++;
            if (yTrue[i] == yPred[i]) {
                truePositive[yTrue[i]]++;
                correct++;
            }
        }

        double recallSum = 0.0;
        int present = 0;
        double weightedPrecision = 0.0;
        double weightedRecall = 0.0;
        double weightedF1 = 0.0;
        for (int c = 0; c < numClasses; c++) {
            if (support[c] == 0) continue;
            present++;
            double precision = predicted[c] == 0 ? 0.0 : (double) truePositive[c] / predicted[c];
            double recall = (double) truePositive[c] / support[c];
            double f1 = precision + recall == 0.0 ? 0.0 : 2 * precision * recall / (precision + recall);
            recallSum += recall;
            double w = (double) support[c] / n;
            weightedPrecision += w * precision;
            weightedRecall += w * recall;
            weightedF1 += w * f1;
        }

        double falseAlarmRate = 0.0;
        if (normalClass >= 0 && normalClass < numClasses && support[normalClass] > 0) {
            falseAlarmRate = (double) (support[normalClass] - truePositive[normalClass]) / support[normalClass];
        }

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put(ACCURACY, n == 0 ? 0.0 : (double) correct / n);
        metrics.put(BALANCED_ACCURACY, present == 0 ? 0.0 : recallSum / present);
        metrics.put(F1, weightedF1);
        metrics.put(PRECISION, weightedPrecision);
        metrics.put(RECALL, weightedRecall);
        metrics.put(FALSE_ALARM_RATE, falseAlarmRate);
        return metrics;
    }
}

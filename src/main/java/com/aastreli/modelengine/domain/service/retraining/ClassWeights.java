package com.aastreli.modelengine.domain.service.retraining;

public final class ClassWeights {

    private ClassWeights() {
    }

    /**
     * Per-sample weights of {@code n / (presentClasses * classCount)}.
     */
    public static double[] balanced(int[] y, int numClasses) {
        int[] counts = new int[numClasses];
        for (int label : y) counts[label]++;
        int present = 0;
        for (int c : counts) if (c > 0) present++;

        double[] weights = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            weights[i] = (double) y.length / (present * counts[y[i]]);
        }
        return weights;
    }
}

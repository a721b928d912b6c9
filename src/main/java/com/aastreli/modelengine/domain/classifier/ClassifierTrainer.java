package com.aastreli.modelengine.domain.classifier;

public interface ClassifierTrainer {

    /**
     * @param features      scaled samples, one row per sample
     * @param labels        encoded class index per sample
     * @param sampleWeights non-negative weight per sample
     * @param numClasses    size of the label space, which may include classes with no samples
     */
    Classifier train(double[][] features, int[] labels, double[] sampleWeights, int numClasses);
}

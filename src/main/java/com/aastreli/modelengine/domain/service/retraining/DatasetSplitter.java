package com.aastreli.modelengine.domain.service.retraining;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Seeded train/validation split. Stratified per class when every class has at least two
 * samples; otherwise a plain shuffled split.
 */
public final class DatasetSplitter {

    private DatasetSplitter() {
    }

    public record Split(double[][] trainX, int[] trainY, double[][] validationX, int[] validationY) {
    }

    public static Split split(double[][] x, int[] y, int numClasses, double validationFraction, long seed) {
        int n = y.length;
        Random random = new Random(seed);

        List<List<Integer>> byClass = new ArrayList<>(numClasses);
        for (int c = 0; c < numClasses; c++) byClass.add(new ArrayList<>());
        for (int i = 0; i < n; i++) byClass.get(y[i]).add(i);

        boolean stratify = byClass.stream().allMatch(idx -> idx.isEmpty() || idx.size() >= 2);

        List<Integer> train = new ArrayList<>();
        List<Integer> validation = new ArrayList<>();
        if (stratify) {
            for (List<Integer> idx : byClass) {
                if (idx.isEmpty()) continue;
                Collections.shuffle(idx, random);
                int take = (int) Math.round(idx.size() * validationFraction);
                take = Math.max(1, Math.min(take, idx.size() - 1));
                validation.addAll(idx.subList(0, take));
                train.addAll(idx.subList(take, idx.size()));
            }
        } else {
            List<Integer> all = new ArrayList<>(n);
            for (int i = 0; i < n; i++) all.add(i);
            Collections.shuffle(all, random);
            int take = n < 2 ? 0 : Math.max(1, Math.min((int) Math.round(n * validationFraction), n - 1));
            validation.addAll(all.subList(0, take));
            train.addAll(all.subList(take, n));
        }
        Collections.shuffle(train, random);

        return new Split(rows(x, train), labels(y, train), rows(x, validation), labels(y, validation));
    }

    private static double[][] rows(double[][] x, List<Integer> idx) {
        double[][] out = new double[idx.size()][];
        for (int i = 0; i < out.length; i++) out[i] = x[idx.get(i)];
        return out;
    }

    private static int[] labels(int[] y, List<Integer> idx) {
        int[] out = new int[idx.size()];
        for (int i = 0; i < out.length; i++) out[i] = y[idx.get(i)];
        return out;
    }
}

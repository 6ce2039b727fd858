package com.incidentlearn.retraining;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

import com.incidentlearn.training.TrainingExample;

public final class StratifiedSplitter {
    private StratifiedSplitter() {
    }

    /** Keeps the newest {@code futureFraction} of examples (by observation time) apart from the rest. */
    public static Split futureSlice(List<TrainingExample> examples, double futureFraction) {
        if (futureFraction < 0.0 || futureFraction >= 1.0) {
            throw new IllegalArgumentException("future fraction must be in [0, 1)");
        }
        List<TrainingExample> ordered = new ArrayList<>(examples);
        ordered.sort(Comparator.comparing(TrainingExample::observedAt).thenComparing(TrainingExample::id));
        int futureSize = (int) Math.floor(ordered.size() * futureFraction);
        int cut = ordered.size() - futureSize;
        return new Split(List.copyOf(ordered.subList(0, cut)), List.copyOf(ordered.subList(cut, ordered.size())));
    }

    /** Label-stratified split; {@code first} holds roughly {@code firstFraction} of each class. */
    public static Split split(List<TrainingExample> examples, double firstFraction, long seed) {
        if (firstFraction <= 0.0 || firstFraction >= 1.0) {
            throw new IllegalArgumentException("split fraction must be in (0, 1)");
        }
        List<TrainingExample> first = new ArrayList<>();
        List<TrainingExample> second = new ArrayList<>();
        for (List<TrainingExample> stratum : strata(examples, seed)) {
            int cut = (int) Math.round(stratum.size() * firstFraction);
            first.addAll(stratum.subList(0, cut));
            second.addAll(stratum.subList(cut, stratum.size()));
        }
        return new Split(List.copyOf(first), List.copyOf(second));
    }

    /** Label-stratified k folds assigned round-robin within each class. */
    public static List<List<TrainingExample>> folds(List<TrainingExample> examples, int k, long seed) {
        if (k < 2) {
            throw new IllegalArgumentException("k-fold cross validation needs k >= 2");
        }
        List<List<TrainingExample>> folds = new ArrayList<>();
        for (int i = 0; i < k; i++) {
            folds.add(new ArrayList<>());
        }
        int next = 0;
        for (List<TrainingExample> stratum : strata(examples, seed)) {
            for (TrainingExample example : stratum) {
                folds.get(next % k).add(example);
                next++;
            }
        }
        return folds;
    }

    private static List<List<TrainingExample>> strata(List<TrainingExample> examples, long seed) {
        List<TrainingExample> positives = new ArrayList<>();
        List<TrainingExample> negatives = new ArrayList<>();
        List<TrainingExample> ordered = new ArrayList<>(examples);
        ordered.sort(Comparator.comparing(TrainingExample::id));
        for (TrainingExample example : ordered) {
            (example.label() ? positives : negatives).add(example);
        }
        Random random = new Random(seed);
        Collections.shuffle(positives, random);
        Collections.shuffle(negatives, random);
        return List.of(positives, negatives);
    }

    public record Split(List<TrainingExample> first, List<TrainingExample> second) {
    }
}

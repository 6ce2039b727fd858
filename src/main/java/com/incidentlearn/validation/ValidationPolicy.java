package com.incidentlearn.validation;

import java.util.List;

public record ValidationPolicy(
        double minAccuracy,
        double minPrecision,
        String primaryMetric,
        double maxCrossFoldStddev,
        int bootstrapSamples,
        double maxBootstrapDeviation,
        double fairnessTolerance,
        List<String> protectedGroupings,
        int minGroupSize,
        double noiseLevel,
        int perturbationsPerExample,
        double minConsistency,
        double maxDriftDegradation,
        long seed) {

    public ValidationPolicy {
        protectedGroupings = protectedGroupings == null ? List.of() : List.copyOf(protectedGroupings);
        if (bootstrapSamples < 1 || perturbationsPerExample < 1) {
            throw new IllegalArgumentException("bootstrapSamples and perturbationsPerExample must be >= 1");
        }
    }

    public static ValidationPolicy defaults() {
        return new ValidationPolicy(0.80, 0.75, "accuracy", 0.05, 200, 0.05, 0.10, List.of("source", "category"), 5,
                0.1, 3, 0.90, 0.10, 42L);
    }
}

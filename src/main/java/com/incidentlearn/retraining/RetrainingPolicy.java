package com.incidentlearn.retraining;

import java.time.Duration;

public record RetrainingPolicy(
        int minSamples,
        double trainFraction,
        int folds,
        double futureFraction,
        double stabilityThreshold,
        String primaryMetric,
        Duration timeout) {

    public RetrainingPolicy {
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be >= 1");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("retraining timeout must be > 0");
        }
    }

    public static RetrainingPolicy defaults() {
        return new RetrainingPolicy(100, 0.8, 5, 0.1, 0.05, "accuracy", Duration.ofHours(2));
    }
}

package com.incidentlearn.pipeline;

import java.time.Duration;

/**
 * Per-cycle windows and budgets. The training window is multiplied by {@link CycleState#windowMultiplier} after a
 * cycle ends for lack of data, up to {@code maxWindowMultiplier}.
 */
public record CycleSettings(
        Duration trainingWindow,
        Duration analysisWindow,
        Duration recentWindow,
        Duration feedbackRetention,
        int maxWindowMultiplier,
        Duration validationTimeout,
        int maxExperimentAttempts,
        int maxRetries,
        long retryBackoffMs) {

    public CycleSettings {
        if (trainingWindow.isNegative() || trainingWindow.isZero() || analysisWindow.isNegative() || analysisWindow.isZero()) {
            throw new IllegalArgumentException("training and analysis windows must be positive");
        }
        if (recentWindow.compareTo(analysisWindow) >= 0) {
            throw new IllegalArgumentException("recent window must be shorter than the analysis window");
        }
        if (maxWindowMultiplier < 1 || maxExperimentAttempts < 1) {
            throw new IllegalArgumentException("maxWindowMultiplier and maxExperimentAttempts must be >= 1");
        }
        if (maxRetries < 0 || retryBackoffMs < 0) {
            throw new IllegalArgumentException("retry settings must be >= 0");
        }
    }

    public static CycleSettings defaults() {
        return new CycleSettings(Duration.ofDays(30), Duration.ofDays(30), Duration.ofDays(1), Duration.ofDays(90), 4,
                Duration.ofMinutes(30), 2, 2, 1000L);
    }
}

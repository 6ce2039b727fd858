package com.incidentlearn.experiment;

import java.time.Duration;
import java.util.List;

public record ExperimentPolicy(
        double defaultTrafficSplit,
        double maxTrafficSplit,
        double significanceLevel,
        Duration horizon,
        long minSamplesPerVariant,
        int maxConcurrentTests,
        double power,
        double minDetectableEffect,
        double maxNegativeImpact,
        double retryHorizonMultiplier,
        List<PrimaryMetric> primaryMetrics,
        List<GuardRailMetric> guardRails) {

    public static final String RESOLUTION_SUCCESS = "resolution_success";
    public static final String RESOLUTION_MINUTES = "resolution_minutes";
    public static final String ESCALATION = "escalation";

    public ExperimentPolicy {
        if (maxTrafficSplit <= 0.0 || maxTrafficSplit > 0.5) {
            throw new IllegalArgumentException("max traffic split must be in (0, 0.5]: " + maxTrafficSplit);
        }
        if (defaultTrafficSplit <= 0.0 || defaultTrafficSplit > maxTrafficSplit) {
            throw new IllegalArgumentException("default traffic split must be in (0, " + maxTrafficSplit + "]: " + defaultTrafficSplit);
        }
        primaryMetrics = primaryMetrics == null ? List.of() : List.copyOf(primaryMetrics);
        guardRails = guardRails == null ? List.of() : List.copyOf(guardRails);
    }

    public static ExperimentPolicy defaults() {
        return new ExperimentPolicy(0.1, 0.5, 0.05, Duration.ofDays(7), 100, 5, 0.8, 0.05, -0.10, 2.0,
                List.of(new PrimaryMetric(RESOLUTION_SUCCESS, MetricKind.RATE, 0.02, true)),
                List.of(new GuardRailMetric(RESOLUTION_MINUTES, MetricKind.CONTINUOUS, false),
                        new GuardRailMetric(ESCALATION, MetricKind.RATE, false)));
    }
}

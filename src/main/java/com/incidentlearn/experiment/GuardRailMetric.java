package com.incidentlearn.experiment;

/** A metric the treatment must not make significantly worse. */
public record GuardRailMetric(String name, MetricKind kind, boolean higherIsBetter) {
    public GuardRailMetric {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("metric name is required");
        }
        kind = kind == null ? MetricKind.CONTINUOUS : kind;
    }
}

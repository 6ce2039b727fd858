package com.incidentlearn.experiment;

/** A metric the treatment must improve by at least {@code minRelativeImprovement} to be adopted. */
public record PrimaryMetric(String name, MetricKind kind, double minRelativeImprovement, boolean higherIsBetter) {
    public PrimaryMetric {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("metric name is required");
        }
        kind = kind == null ? MetricKind.CONTINUOUS : kind;
    }
}

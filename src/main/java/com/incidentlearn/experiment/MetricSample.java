package com.incidentlearn.experiment;

import java.time.Instant;

public record MetricSample(String testId, Variant variant, String metricName, double value, Instant observedAt, String subjectId) {
    public MetricSample {
        if (testId == null || variant == null || metricName == null || observedAt == null) {
            throw new IllegalArgumentException("testId, variant, metricName and observedAt are required");
        }
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("sample value must be finite: " + value);
        }
    }
}

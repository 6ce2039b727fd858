package com.incidentlearn.patterns;

import java.time.Instant;

/** Running mean and variance of one behaviour metric for one subject. */
public record Baseline(String subject, String metric, double mean, double variance, long count, Instant updatedAt) {
    public static String key(String subject, String metric) {
        return subject + "|" + metric;
    }

    public String key() {
        return key(subject, metric);
    }

    /** Exponentially blends {@code observed} into this baseline. */
    public Baseline blend(Baseline observed, double smoothing) {
        double alpha = Math.max(0.0, Math.min(1.0, smoothing));
        return new Baseline(
                subject,
                metric,
                (1 - alpha) * mean + alpha * observed.mean(),
                (1 - alpha) * variance + alpha * observed.variance(),
                count + observed.count(),
                observed.updatedAt());
    }
}

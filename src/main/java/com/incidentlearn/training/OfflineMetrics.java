package com.incidentlearn.training;

/** Cross-validated estimates (mean and stddev over folds) plus the score on the held-out split. */
public record OfflineMetrics(
        MetricEstimate accuracy,
        MetricEstimate precision,
        MetricEstimate recall,
        MetricEstimate f1,
        int folds,
        ClassificationMetrics holdout,
        long trainingSamples,
        long holdoutSamples,
        long futureSamples) {

    public MetricEstimate estimate(String metric) {
        return switch (metric) {
            case ClassificationMetrics.ACCURACY -> accuracy;
            case ClassificationMetrics.PRECISION -> precision;
            case ClassificationMetrics.RECALL -> recall;
            case ClassificationMetrics.F1 -> f1;
            default -> throw new IllegalArgumentException("Unknown metric " + metric);
        };
    }
}

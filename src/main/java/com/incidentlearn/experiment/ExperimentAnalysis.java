package com.incidentlearn.experiment;

import java.util.List;
import java.util.Optional;

public record ExperimentAnalysis(
        String testId,
        Decision decision,
        String rationale,
        double adjustedAlpha,
        long controlSamples,
        long treatmentSamples,
        List<MetricAnalysis> metrics) {

    public ExperimentAnalysis {
        metrics = metrics == null ? List.of() : List.copyOf(metrics);
    }

    public ExperimentAnalysis withDecision(Decision nextDecision, String nextRationale) {
        return new ExperimentAnalysis(testId, nextDecision, nextRationale, adjustedAlpha, controlSamples, treatmentSamples, metrics);
    }

    public Optional<MetricAnalysis> metric(String name) {
        return metrics.stream().filter(metric -> metric.metricName().equals(name)).findFirst();
    }
}

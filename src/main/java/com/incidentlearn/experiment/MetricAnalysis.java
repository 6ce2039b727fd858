package com.incidentlearn.experiment;

import com.incidentlearn.stats.TestResult;

/**
 * Outcome for one metric. {@code directionalImprovement} is the relative change expressed so that positive always
 * means better for the treatment. {@code result} is null when a variant had fewer than two samples.
 */
public record MetricAnalysis(
        String metricName,
        MetricKind kind,
        Role role,
        long controlCount,
        long treatmentCount,
        TestResult result,
        double alpha,
        boolean significant,
        double directionalImprovement,
        boolean improvementMet,
        boolean worse) {

    public enum Role {
        PRIMARY,
        GUARD_RAIL
    }

    public boolean insufficientData() {
        return result == null;
    }
}

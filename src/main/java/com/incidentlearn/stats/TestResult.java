package com.incidentlearn.stats;

public record TestResult(
        String testName,
        double statistic,
        double degreesOfFreedom,
        double pValue,
        double controlMean,
        double treatmentMean,
        double difference,
        double relativeImprovement,
        double standardError,
        double effectSize,
        double confidenceLow,
        double confidenceHigh) {

    public boolean significantAt(double alpha) {
        return pValue < alpha;
    }
}

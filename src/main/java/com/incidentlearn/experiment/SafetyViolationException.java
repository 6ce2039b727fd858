package com.incidentlearn.experiment;

/**
 * A running experiment harmed a primary metric beyond the allowed negative impact, or made a guard-rail metric
 * significantly worse. The test has been aborted by the time this is thrown.
 */
public class SafetyViolationException extends RuntimeException {
    private final String testId;
    private final String metricName;
    private final double relativeImpact;

    public SafetyViolationException(String testId, String metricName, double relativeImpact) {
        super(String.format("A/B test %s aborted: %s moved %.2f%% in the harmful direction", testId, metricName, relativeImpact * 100));
        this.testId = testId;
        this.metricName = metricName;
        this.relativeImpact = relativeImpact;
    }

    public String testId() {
        return testId;
    }

    public String metricName() {
        return metricName;
    }

    public double relativeImpact() {
        return relativeImpact;
    }
}

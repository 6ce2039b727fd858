package com.incidentlearn.stats;

public record SampleSummary(long count, double mean, double variance) {
    public SampleSummary {
        if (count < 0 || variance < 0) {
            throw new IllegalArgumentException("count and variance must be >= 0");
        }
    }

    public static SampleSummary of(double[] values) {
        return new SampleSummary(values.length, Descriptive.mean(values), Descriptive.variance(values));
    }

    /** Summary of a 0/1 outcome series. */
    public long successes() {
        return Math.round(mean * count);
    }
}

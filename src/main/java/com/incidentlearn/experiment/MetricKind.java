package com.incidentlearn.experiment;

/** Continuous metrics are compared with Welch's t-test, rates (0/1 outcomes) with a two-proportion z-test. */
public enum MetricKind {
    CONTINUOUS,
    RATE
}

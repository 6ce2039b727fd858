package com.incidentlearn.metrics;

public enum AggregateFunction {
    SUM,
    AVG,
    MIN,
    MAX,
    COUNT,
    P50,
    P95,
    P99
}

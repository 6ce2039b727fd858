package com.incidentlearn.training;

import java.util.List;

import com.incidentlearn.stats.Descriptive;

public record MetricEstimate(double mean, double stddev) {
    public static MetricEstimate of(List<Double> values) {
        return new MetricEstimate(Descriptive.mean(values), Descriptive.stddev(values));
    }
}

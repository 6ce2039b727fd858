package com.incidentlearn.metrics;

import java.time.Instant;
import java.util.List;

import com.incidentlearn.stats.Descriptive;

public record MetricAggregate(
        Instant bucketStart,
        long count,
        double sum,
        double avg,
        double min,
        double max,
        double p50,
        double p95,
        double p99,
        double stddev) {

    public static MetricAggregate of(Instant bucketStart, List<Double> values) {
        if (values.isEmpty()) {
            return new MetricAggregate(bucketStart, 0, 0, 0, 0, 0, 0, 0, 0, 0);
        }
        double[] data = values.stream().mapToDouble(Double::doubleValue).toArray();
        double sum = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : data) {
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        return new MetricAggregate(
                bucketStart,
                data.length,
                sum,
                sum / data.length,
                min,
                max,
                Descriptive.percentile(data, 0.50),
                Descriptive.percentile(data, 0.95),
                Descriptive.percentile(data, 0.99),
                Descriptive.stddev(data));
    }

    public double value(AggregateFunction function) {
        return switch (function) {
            case SUM -> sum;
            case AVG -> avg;
            case MIN -> min;
            case MAX -> max;
            case COUNT -> count;
            case P50 -> p50;
            case P95 -> p95;
            case P99 -> p99;
        };
    }
}

package com.incidentlearn.stats;

import java.util.Arrays;
import java.util.Collection;

public final class Descriptive {
    private Descriptive() {
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    public static double mean(Collection<Double> values) {
        return mean(values.stream().mapToDouble(Double::doubleValue).toArray());
    }

    /** Sample variance (n - 1 denominator); 0 for fewer than two values. */
    public static double variance(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double sq = 0;
        for (double v : values) {
            double d = v - mean;
            sq += d * d;
        }
        return sq / (values.length - 1);
    }

    public static double stddev(double[] values) {
        return Math.sqrt(variance(values));
    }

    public static double stddev(Collection<Double> values) {
        return stddev(values.stream().mapToDouble(Double::doubleValue).toArray());
    }

    /** Nearest-rank percentile, {@code p} in [0, 1]. */
    public static double percentile(double[] values, double p) {
        if (values.length == 0) {
            return 0.0;
        }
        if (p < 0.0 || p > 1.0) {
            throw new IllegalArgumentException("percentile must be within [0, 1]: " + p);
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int index = (int) Math.ceil(sorted.length * p) - 1;
        return sorted[Math.max(0, Math.min(sorted.length - 1, index))];
    }
}

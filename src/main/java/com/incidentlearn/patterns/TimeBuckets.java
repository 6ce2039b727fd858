package com.incidentlearn.patterns;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;

final class TimeBuckets {
    private TimeBuckets() {
    }

    static int bucketCount(Instant start, Instant end, Duration width) {
        long span = Duration.between(start, end).toMillis();
        return (int) Math.max(0, (span + width.toMillis() - 1) / width.toMillis());
    }

    static int index(Instant start, Instant instant, Duration width) {
        return (int) (Duration.between(start, instant).toMillis() / width.toMillis());
    }

    /** Event counts per fixed-width bucket in {@code [start, end]}; an event at {@code end} falls in the last bucket. */
    static double[] counts(Collection<Instant> instants, Instant start, Instant end, Duration width) {
        double[] counts = new double[bucketCount(start, end, width)];
        if (counts.length == 0) {
            return counts;
        }
        for (Instant instant : instants) {
            if (instant.isBefore(start) || instant.isAfter(end)) {
                continue;
            }
            counts[Math.min(counts.length - 1, index(start, instant, width))]++;
        }
        return counts;
    }
}

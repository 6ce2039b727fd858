package com.incidentlearn.patterns;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.incidentlearn.corpus.IncidentObservation;
import com.incidentlearn.stats.Descriptive;
import com.incidentlearn.stats.Distributions;

/** Reports recent volume buckets whose z-score against the whole analysis window exceeds a threshold. */
public class VolumeAnomalyDetector implements PatternDetector {
    private final double zThreshold;
    private final Duration bucketWidth;
    private final int minBuckets;

    public VolumeAnomalyDetector(double zThreshold, Duration bucketWidth, int minBuckets) {
        this.zThreshold = zThreshold;
        this.bucketWidth = bucketWidth;
        this.minBuckets = Math.max(3, minBuckets);
    }

    @Override
    public String name() {
        return "volume-anomaly";
    }

    @Override
    public List<Pattern> detect(AnalysisInput input) {
        Instant start = input.analysisWindow().start();
        double[] counts = TimeBuckets.counts(
                input.incidents().stream().map(IncidentObservation::occurredAt).toList(),
                start,
                input.analysisWindow().end(),
                bucketWidth);
        if (counts.length < minBuckets) {
            return List.of();
        }
        double mean = Descriptive.mean(counts);
        double stddev = Descriptive.stddev(counts);
        if (stddev == 0.0) {
            return List.of();
        }
        List<Pattern> patterns = new ArrayList<>();
        for (int i = 0; i < counts.length; i++) {
            Instant bucketStart = start.plus(bucketWidth.multipliedBy(i));
            if (!input.recentWindow().contains(bucketStart)) {
                continue;
            }
            double z = (counts[i] - mean) / stddev;
            if (z <= zThreshold) {
                continue;
            }
            Instant bucketEnd = bucketStart.plus(bucketWidth);
            List<String> ids = input.incidents().stream()
                    .filter(incident -> !incident.occurredAt().isBefore(bucketStart) && incident.occurredAt().isBefore(bucketEnd))
                    .map(IncidentObservation::incidentId)
                    .toList();
            Map<String, Double> statistics = new HashMap<>();
            statistics.put("count", counts[i]);
            statistics.put("mean", mean);
            statistics.put("stddev", stddev);
            statistics.put("zScore", z);
            patterns.add(Pattern.detected(
                    PatternKind.ANOMALY,
                    "volume:" + bucketStart,
                    new PatternEvidence(statistics, ids, Map.of("bucketWidth", bucketWidth.toString())),
                    2.0 * Distributions.normalCdf(z) - 1.0,
                    input.analyzedAt()));
        }
        return patterns;
    }
}

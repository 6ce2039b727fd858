package com.incidentlearn.patterns;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import com.incidentlearn.corpus.IncidentObservation;
import com.incidentlearn.feedback.FeedbackOutcome;
import com.incidentlearn.feedback.FeedbackRecord;
import com.incidentlearn.stats.Descriptive;
import com.incidentlearn.stats.LinearRegression;

/**
 * Least-squares trend of per-category incident volume and of the overall feedback failure rate per bucket.
 * Seasonality is attached as evidence only and never triggers a pattern on its own.
 */
public class TrendDetector implements PatternDetector {
    private final double significanceLevel;
    private final double minRelativeSlope;
    private final int minPoints;
    private final Duration bucketWidth;
    private final int projectionBuckets;

    public TrendDetector(double significanceLevel, double minRelativeSlope, int minPoints, Duration bucketWidth, int projectionBuckets) {
        if (significanceLevel <= 0.0 || significanceLevel >= 1.0) {
            throw new IllegalArgumentException("trend significance must be in (0, 1)");
        }
        if (minPoints < 3) {
            throw new IllegalArgumentException("trend needs at least three points");
        }
        this.significanceLevel = significanceLevel;
        this.minRelativeSlope = minRelativeSlope;
        this.minPoints = minPoints;
        this.bucketWidth = bucketWidth;
        this.projectionBuckets = projectionBuckets;
    }

    @Override
    public String name() {
        return "trend";
    }

    @Override
    public List<Pattern> detect(AnalysisInput input) {
        Instant start = input.analysisWindow().start();
        Instant end = input.analysisWindow().end();
        List<Pattern> patterns = new ArrayList<>();

        Map<String, List<IncidentObservation>> byCategory = new TreeMap<>();
        for (IncidentObservation incident : input.incidents()) {
            byCategory.computeIfAbsent(incident.category(), ignored -> new ArrayList<>()).add(incident);
        }
        byCategory.forEach((category, incidents) -> {
            if (incidents.size() < minPoints) {
                return;
            }
            List<Instant> timestamps = incidents.stream().map(IncidentObservation::occurredAt).toList();
            double[] series = TimeBuckets.counts(timestamps, start, end, bucketWidth);
            Map<String, Double> extra = new HashMap<>();
            SeasonalityProfile.of(timestamps).addTo(extra);
            evaluate("category:" + category + ":volume", Series.contiguous(series), extra,
                    incidents.stream().map(IncidentObservation::incidentId).toList(), input)
                    .ifPresent(patterns::add);
        });

        failureRateSeries(input.feedback(), start, end).ifPresent(series ->
                evaluate("feedback:failure_rate", series, new HashMap<>(), List.of(), input).ifPresent(patterns::add));
        return patterns;
    }

    private Optional<Pattern> evaluate(String subject, Series series, Map<String, Double> extra, List<String> sampleIds,
            AnalysisInput input) {
        if (series.y().length < minPoints) {
            return Optional.empty();
        }
        LinearRegression.Fit fit = LinearRegression.fit(series.x(), series.y());
        double mean = Descriptive.mean(series.y());
        double relativeSlope = mean == 0.0 ? 0.0 : Math.abs(fit.slope()) / Math.abs(mean);
        if (fit.pValue() >= significanceLevel || relativeSlope < minRelativeSlope) {
            return Optional.empty();
        }
        Map<String, Double> statistics = new HashMap<>(extra);
        statistics.put("slope", fit.slope());
        statistics.put("intercept", fit.intercept());
        statistics.put("pValue", fit.pValue());
        statistics.put("rSquared", fit.rSquared());
        statistics.put("meanPerBucket", mean);
        statistics.put("relativeSlope", relativeSlope);
        statistics.put("buckets", (double) series.y().length);
        statistics.put("projected", Math.max(0.0, fit.predict(series.lastBucket() + projectionBuckets)));
        Map<String, String> notes = Map.of(
                "direction", fit.slope() > 0 ? "increasing" : "decreasing",
                "bucketWidth", bucketWidth.toString());
        return Optional.of(Pattern.detected(PatternKind.TREND, subject,
                new PatternEvidence(statistics, sampleIds, notes), 1.0 - fit.pValue(), input.analyzedAt()));
    }

    /** Failure rate per bucket that has feedback; empty buckets are skipped but keep their place on the time axis. */
    private Optional<Series> failureRateSeries(List<FeedbackRecord> feedback, Instant start, Instant end) {
        int buckets = TimeBuckets.bucketCount(start, end, bucketWidth);
        double[] failures = new double[buckets];
        double[] totals = new double[buckets];
        for (FeedbackRecord record : feedback) {
            if (buckets == 0 || record.outcome() == FeedbackOutcome.UNKNOWN || record.recordedAt().isBefore(start)
                    || record.recordedAt().isAfter(end)) {
                continue;
            }
            int index = Math.min(buckets - 1, TimeBuckets.index(start, record.recordedAt(), bucketWidth));
            totals[index]++;
            if (record.outcome() == FeedbackOutcome.FAILURE) {
                failures[index]++;
            }
        }
        List<Integer> positions = new ArrayList<>();
        List<Double> rates = new ArrayList<>();
        for (int i = 0; i < buckets; i++) {
            if (totals[i] > 0) {
                positions.add(i);
                rates.add(failures[i] / totals[i]);
            }
        }
        if (rates.size() < minPoints) {
            return Optional.empty();
        }
        return Optional.of(new Series(
                positions.stream().mapToDouble(Integer::doubleValue).toArray(),
                rates.stream().mapToDouble(Double::doubleValue).toArray(),
                buckets - 1));
    }

    /** Regression input; {@code x} holds bucket indexes so gaps in time stay in the slope. */
    record Series(double[] x, double[] y, int lastBucket) {
        static Series contiguous(double[] y) {
            double[] x = new double[y.length];
            for (int i = 0; i < x.length; i++) {
                x[i] = i;
            }
            return new Series(x, y, y.length - 1);
        }
    }
}

package com.incidentlearn.patterns;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.incidentlearn.corpus.IncidentObservation;
import com.incidentlearn.feedback.FeedbackOutcome;
import com.incidentlearn.feedback.FeedbackRecord;
import com.incidentlearn.stats.Descriptive;
import com.incidentlearn.stats.Distributions;

/**
 * Compares trailing per-category statistics with stored baselines: resolution time of recent incidents, and
 * failure rate and latency of recent feedback.
 */
public class BehaviorShiftDetector implements PatternDetector {
    static final String RESOLUTION_MINUTES = "resolution_minutes";
    static final String FAILURE_RATE = "failure_rate";
    static final String LATENCY_MINUTES = "latency_minutes";

    private final double relativeDeviationThreshold;
    private final int minSamples;

    public BehaviorShiftDetector(double relativeDeviationThreshold, int minSamples) {
        if (relativeDeviationThreshold <= 0.0) {
            throw new IllegalArgumentException("relative deviation threshold must be > 0");
        }
        this.relativeDeviationThreshold = relativeDeviationThreshold;
        this.minSamples = Math.max(1, minSamples);
    }

    @Override
    public String name() {
        return "behavior-shift";
    }

    @Override
    public List<Pattern> detect(AnalysisInput input) {
        List<Pattern> patterns = new ArrayList<>();
        for (Baseline observed : observe(input).values()) {
            Baseline baseline = input.baselines().get(observed.key());
            if (baseline == null || baseline.count() < minSamples || observed.count() < minSamples) {
                continue;
            }
            double relativeDeviation = baseline.mean() == 0.0
                    ? (observed.mean() == 0.0 ? 0.0 : Double.POSITIVE_INFINITY)
                    : Math.abs(observed.mean() - baseline.mean()) / Math.abs(baseline.mean());
            if (relativeDeviation <= relativeDeviationThreshold) {
                continue;
            }
            double z = zScore(observed, baseline);
            double confidence = Double.isInfinite(z) ? 1.0 : 2.0 * Distributions.normalCdf(Math.abs(z)) - 1.0;

            Map<String, Double> statistics = new HashMap<>();
            statistics.put("baselineMean", baseline.mean());
            statistics.put("baselineVariance", baseline.variance());
            statistics.put("currentMean", observed.mean());
            statistics.put("currentVariance", observed.variance());
            statistics.put("currentCount", (double) observed.count());
            statistics.put("relativeDeviation", Double.isInfinite(relativeDeviation) ? Double.MAX_VALUE : relativeDeviation);
            statistics.put("zScore", Double.isInfinite(z) ? Double.MAX_VALUE : z);
            Map<String, String> notes = new HashMap<>();
            notes.put("metric", observed.metric());
            notes.put("direction", observed.mean() > baseline.mean() ? "increase" : "decrease");
            patterns.add(Pattern.detected(
                    PatternKind.BEHAVIOR_SHIFT,
                    observed.subject() + ":" + observed.metric(),
                    new PatternEvidence(statistics, sampleIds(input, observed.subject()), notes),
                    confidence,
                    input.analyzedAt()));
        }
        return patterns;
    }

    /** Current statistics become the initial baseline where none exists; existing baselines are blended by the analyzer. */
    @Override
    public Map<String, Baseline> baselineUpdates(AnalysisInput input) {
        return observe(input);
    }

    Map<String, Baseline> observe(AnalysisInput input) {
        Map<String, Map<String, List<Double>>> valuesBySubject = new TreeMap<>();
        for (IncidentObservation incident : input.recentIncidents()) {
            if (incident.resolutionTime() != null) {
                add(valuesBySubject, "category:" + incident.category(), RESOLUTION_MINUTES, minutes(incident.resolutionTime()));
            }
        }
        Map<String, IncidentObservation> incidents = input.incidentsById();
        for (FeedbackRecord record : input.feedback()) {
            if (!input.recentWindow().contains(record.recordedAt())) {
                continue;
            }
            IncidentObservation incident = incidents.get(record.incidentId());
            String subject = incident == null ? "category:uncategorized" : "category:" + incident.category();
            if (record.outcome() != FeedbackOutcome.UNKNOWN) {
                add(valuesBySubject, subject, FAILURE_RATE, record.outcome() == FeedbackOutcome.FAILURE ? 1.0 : 0.0);
            }
            if (record.latencyToResolution() != null) {
                add(valuesBySubject, subject, LATENCY_MINUTES, minutes(record.latencyToResolution()));
            }
        }

        Map<String, Baseline> observed = new LinkedHashMap<>();
        valuesBySubject.forEach((subject, metrics) -> metrics.forEach((metric, values) -> {
            double[] data = values.stream().mapToDouble(Double::doubleValue).toArray();
            Baseline baseline = new Baseline(subject, metric, Descriptive.mean(data), Descriptive.variance(data), data.length, input.analyzedAt());
            observed.put(baseline.key(), baseline);
        }));
        return observed;
    }

    private double zScore(Baseline observed, Baseline baseline) {
        double variance = baseline.variance() > 0 ? baseline.variance() : observed.variance();
        double difference = observed.mean() - baseline.mean();
        if (variance <= 0) {
            return difference == 0.0 ? 0.0 : Math.copySign(Double.POSITIVE_INFINITY, difference);
        }
        return difference / Math.sqrt(variance / observed.count());
    }

    private List<String> sampleIds(AnalysisInput input, String subject) {
        return input.recentIncidents().stream()
                .filter(incident -> subject.equals("category:" + incident.category()))
                .map(IncidentObservation::incidentId)
                .toList();
    }

    private static void add(Map<String, Map<String, List<Double>>> values, String subject, String metric, double value) {
        values.computeIfAbsent(subject, ignored -> new TreeMap<>()).computeIfAbsent(metric, ignored -> new ArrayList<>()).add(value);
    }

    private static double minutes(Duration duration) {
        return duration.toMillis() / 60_000.0;
    }
}

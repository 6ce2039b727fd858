package com.incidentlearn.patterns;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.incidentlearn.metrics.MetricNames;
import com.incidentlearn.metrics.MetricsService;

/**
 * Runs every detector concurrently on the same snapshot, joins, and merges their output in detector order without
 * deduplication. A failing or slow detector contributes nothing and does not affect the others.
 */
public class PatternAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(PatternAnalyzer.class);
    private static final Map<PatternKind, String> KIND_METRICS = new EnumMap<>(Map.of(
            PatternKind.NEW_CLUSTER, MetricNames.PATTERNS_NEW_TYPES,
            PatternKind.BEHAVIOR_SHIFT, MetricNames.PATTERNS_BEHAVIOR_CHANGES,
            PatternKind.TREND, MetricNames.PATTERNS_TRENDS,
            PatternKind.CORRELATION, MetricNames.PATTERNS_CORRELATIONS,
            PatternKind.ANOMALY, MetricNames.PATTERNS_ANOMALIES));

    private final List<PatternDetector> detectors;
    private final PatternStore patternStore;
    private final BaselineStore baselineStore;
    private final MetricsService metrics;
    private final ExecutorService executor;
    private final Duration detectorTimeout;
    private final double baselineSmoothing;

    public PatternAnalyzer(
            List<PatternDetector> detectors,
            PatternStore patternStore,
            BaselineStore baselineStore,
            MetricsService metrics,
            ExecutorService executor,
            Duration detectorTimeout,
            double baselineSmoothing) {
        this.detectors = List.copyOf(detectors);
        this.patternStore = Objects.requireNonNull(patternStore, "patternStore");
        this.baselineStore = Objects.requireNonNull(baselineStore, "baselineStore");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.detectorTimeout = Objects.requireNonNull(detectorTimeout, "detectorTimeout");
        this.baselineSmoothing = baselineSmoothing;
    }

    public Map<String, Baseline> baselines() throws IOException {
        return baselineStore.load();
    }

    public List<Pattern> analyze(AnalysisInput input) throws IOException, InterruptedException {
        Map<PatternDetector, Future<DetectorOutput>> futures = new LinkedHashMap<>();
        for (PatternDetector detector : detectors) {
            futures.put(detector, executor.submit(() -> new DetectorOutput(detector.detect(input), detector.baselineUpdates(input))));
        }

        long deadline = System.nanoTime() + detectorTimeout.toNanos();
        List<Pattern> merged = new ArrayList<>();
        Map<String, Baseline> observed = new LinkedHashMap<>();
        for (Map.Entry<PatternDetector, Future<DetectorOutput>> entry : futures.entrySet()) {
            String name = entry.getKey().name();
            try {
                DetectorOutput output = entry.getValue().get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                merged.addAll(output.patterns());
                observed.putAll(output.baselines());
                log.debug("patterns.detector.completed detector={} patterns={}", name, output.patterns().size());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                detectorFailed(name, cause.getMessage());
            } catch (TimeoutException e) {
                entry.getValue().cancel(true);
                detectorFailed(name, "timed out after " + detectorTimeout);
            }
        }

        List<Pattern> stored = patternStore.appendAll(merged);
        if (!observed.isEmpty()) {
            baselineStore.merge(observed, baselineSmoothing);
        }
        for (Pattern pattern : stored) {
            metrics.increment(KIND_METRICS.get(pattern.kind()));
        }
        log.info("patterns.analyzed detectors={} patterns={}", detectors.size(), stored.size());
        return stored;
    }

    private void detectorFailed(String detector, String reason) {
        metrics.increment(MetricNames.PATTERNS_DETECTOR_FAILURES, Map.of("detector", detector));
        log.warn("patterns.detector.failed detector={} reason={}", detector, reason);
    }

    private record DetectorOutput(List<Pattern> patterns, Map<String, Baseline> baselines) {
    }
}

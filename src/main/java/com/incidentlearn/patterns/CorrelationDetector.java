package com.incidentlearn.patterns;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.incidentlearn.corpus.IncidentObservation;
import com.incidentlearn.stats.Correlation;

/** Pairwise Pearson correlation of per-system incident counts over fixed time buckets. */
public class CorrelationDetector implements PatternDetector {
    private final double correlationThreshold;
    private final int minSupport;
    private final Duration bucketWidth;

    public CorrelationDetector(double correlationThreshold, int minSupport, Duration bucketWidth) {
        if (correlationThreshold <= 0.0 || correlationThreshold > 1.0) {
            throw new IllegalArgumentException("correlation threshold must be in (0, 1]");
        }
        this.correlationThreshold = correlationThreshold;
        this.minSupport = Math.max(1, minSupport);
        this.bucketWidth = bucketWidth;
    }

    @Override
    public String name() {
        return "correlation";
    }

    @Override
    public List<Pattern> detect(AnalysisInput input) {
        List<IncidentObservation> incidents = input.incidents();
        if (incidents.isEmpty()) {
            return List.of();
        }
        Instant start = incidents.stream().map(IncidentObservation::occurredAt).min(Instant::compareTo).orElseThrow();
        Instant end = incidents.stream().map(IncidentObservation::occurredAt).max(Instant::compareTo).orElseThrow().plus(bucketWidth);

        Map<String, List<Instant>> bySystem = new TreeMap<>();
        Map<String, List<String>> idsBySystem = new HashMap<>();
        for (IncidentObservation incident : incidents) {
            bySystem.computeIfAbsent(incident.system(), ignored -> new ArrayList<>()).add(incident.occurredAt());
            idsBySystem.computeIfAbsent(incident.system(), ignored -> new ArrayList<>()).add(incident.incidentId());
        }
        List<String> systems = new ArrayList<>(bySystem.keySet());
        Map<String, double[]> series = new HashMap<>();
        for (String system : systems) {
            series.put(system, TimeBuckets.counts(bySystem.get(system), start, end, bucketWidth));
        }

        List<Pattern> patterns = new ArrayList<>();
        for (int i = 0; i < systems.size(); i++) {
            for (int j = i + 1; j < systems.size(); j++) {
                double[] a = series.get(systems.get(i));
                double[] b = series.get(systems.get(j));
                int cooccurrence = 0;
                for (int k = 0; k < a.length; k++) {
                    if (a[k] > 0 && b[k] > 0) {
                        cooccurrence++;
                    }
                }
                if (cooccurrence < minSupport) {
                    continue;
                }
                Correlation.Result result = Correlation.pearson(a, b);
                if (Math.abs(result.coefficient()) < correlationThreshold) {
                    continue;
                }
                Map<String, Double> statistics = new HashMap<>();
                statistics.put("coefficient", result.coefficient());
                statistics.put("pValue", result.pValue());
                statistics.put("cooccurrence", (double) cooccurrence);
                statistics.put("buckets", (double) a.length);
                List<String> samples = new ArrayList<>(idsBySystem.get(systems.get(i)).subList(0, Math.min(5, idsBySystem.get(systems.get(i)).size())));
                samples.addAll(idsBySystem.get(systems.get(j)).subList(0, Math.min(5, idsBySystem.get(systems.get(j)).size())));
                patterns.add(Pattern.detected(
                        PatternKind.CORRELATION,
                        "system:" + systems.get(i) + "|system:" + systems.get(j),
                        new PatternEvidence(statistics, samples, Map.of("bucketWidth", bucketWidth.toString())),
                        Math.abs(result.coefficient()) * (1.0 - result.pValue()),
                        input.analyzedAt()));
            }
        }
        return patterns;
    }
}

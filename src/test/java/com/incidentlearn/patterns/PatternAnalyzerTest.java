package com.incidentlearn.patterns;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.incidentlearn.MutableClock;
import com.incidentlearn.feedback.TimeWindow;
import com.incidentlearn.metrics.MetricNames;
import com.incidentlearn.metrics.MetricsService;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PatternAnalyzerTest {
    private static final Instant NOW = Instant.parse("2026-02-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private final ExecutorService executor = Executors.newFixedThreadPool(3);
    private final MetricsService metrics = new MetricsService(null, MutableClock.startingAt("2026-02-01T00:00:00Z"));

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void shouldIsolateFailingAndSlowDetectors() throws Exception {
        PatternAnalyzer analyzer = analyzer(List.of(new FixedDetector("fixed"), new FailingDetector(), new SlowDetector()));

        List<Pattern> stored = analyzer.analyze(input());

        assertEquals(1, stored.size());
        assertEquals("trend-1", stored.get(0).id());
        assertNull(stored.get(0).supersedes());
        assertEquals(1.0, metrics.total(MetricNames.PATTERNS_TRENDS), 0.0);
        assertEquals(1.0, metrics.total(MetricNames.PATTERNS_DETECTOR_FAILURES, Map.of("detector", "failing")), 0.0);
        assertEquals(1.0, metrics.total(MetricNames.PATTERNS_DETECTOR_FAILURES, Map.of("detector", "slow")), 0.0);
    }

    @Test
    void shouldLinkRepeatedPatternsAndBlendBaselines() throws Exception {
        PatternAnalyzer analyzer = analyzer(List.of(new FixedDetector("fixed")));

        analyzer.analyze(input());
        List<Pattern> second = analyzer.analyze(input());

        assertEquals("trend-2", second.get(0).id());
        assertEquals("trend-1", second.get(0).supersedes());
        Baseline blended = analyzer.baselines().get(Baseline.key("category:api", "resolution_minutes"));
        assertEquals(10.0, blended.mean(), 1e-9);
        assertEquals(2, blended.count());

        PatternStore reopened = new PatternStore(tempDir.resolve("patterns.jsonl"));
        assertEquals(2, reopened.history(PatternKind.TREND, "category:api:volume").size());
    }

    @Test
    void shouldClampConfidenceAndCapSampleIds() {
        Pattern pattern = Pattern.detected(PatternKind.ANOMALY, "volume:x",
                new PatternEvidence(Map.of(), List.of("1", "2", "3", "4", "5", "6", "7", "8", "9", "10", "11", "12"), Map.of()), 1.7, NOW);

        assertEquals(1.0, pattern.confidence(), 0.0);
        assertEquals(PatternEvidence.MAX_SAMPLE_IDS, pattern.evidence().sampleRecordIds().size());
        assertTrue(Pattern.detected(PatternKind.ANOMALY, "volume:x", null, -1.0, NOW).confidence() == 0.0);
    }

    private PatternAnalyzer analyzer(List<PatternDetector> detectors) throws Exception {
        return new PatternAnalyzer(detectors, new PatternStore(tempDir.resolve("patterns.jsonl")), new BaselineStore(tempDir.resolve("baselines.json")),
                metrics, executor, Duration.ofMillis(300), 0.5);
    }

    private static AnalysisInput input() {
        return new AnalysisInput(TimeWindow.trailing(NOW, Duration.ofDays(30)), TimeWindow.trailing(NOW, Duration.ofDays(1)), List.of(), List.of(),
                Map.of(), NOW);
    }

    private static final class FixedDetector implements PatternDetector {
        private final String name;

        private FixedDetector(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public List<Pattern> detect(AnalysisInput input) {
            return List.of(Pattern.detected(PatternKind.TREND, "category:api:volume",
                    new PatternEvidence(Map.of("slope", 1.0), List.of("INC-1"), Map.of()), 0.9, input.analyzedAt()));
        }

        @Override
        public Map<String, Baseline> baselineUpdates(AnalysisInput input) {
            Baseline baseline = new Baseline("category:api", "resolution_minutes", 10.0, 4.0, 1, input.analyzedAt());
            return Map.of(baseline.key(), baseline);
        }
    }

    private static final class FailingDetector implements PatternDetector {
        @Override
        public String name() {
            return "failing";
        }

        @Override
        public List<Pattern> detect(AnalysisInput input) {
            throw new IllegalStateException("embedding backend unavailable");
        }
    }

    private static final class SlowDetector implements PatternDetector {
        @Override
        public String name() {
            return "slow";
        }

        @Override
        public List<Pattern> detect(AnalysisInput input) {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of(Pattern.detected(PatternKind.ANOMALY, "volume:late", null, 0.5, input.analyzedAt()));
        }
    }
}

package com.incidentlearn.metrics;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.incidentlearn.MutableClock;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetricsServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldAggregateTaggedSeriesIntoHourlyBuckets() {
        MutableClock clock = MutableClock.startingAt("2026-01-01T10:05:00Z");
        MetricsService metrics = new MetricsService(null, clock);
        for (int i = 1; i <= 20; i++) {
            metrics.record("learning.cycle_duration", i * 100, Map.of("family", "network"));
        }
        metrics.record("learning.cycle_duration", 99_999, Map.of("family", "storage"));
        clock.advance(Duration.ofHours(1));
        metrics.record("learning.cycle_duration", 500, Map.of("family", "network"));

        List<MetricAggregate> buckets = metrics.query("learning.cycle_duration", Map.of("family", "network"),
                Instant.parse("2026-01-01T00:00:00Z"), Instant.parse("2026-01-02T00:00:00Z"), Granularity.HOUR);

        assertEquals(2, buckets.size());
        MetricAggregate first = buckets.get(0);
        assertEquals(Instant.parse("2026-01-01T10:00:00Z"), first.bucketStart());
        assertEquals(20, first.count());
        assertEquals(1050.0, first.avg(), 1e-9);
        assertEquals(1000.0, first.p50(), 0.0);
        assertEquals(1900.0, first.p95(), 0.0);
        assertEquals(2000.0, first.p99(), 0.0);
        assertEquals(1, buckets.get(1).count());
        assertEquals(21_500.0, metrics.total("learning.cycle_duration", Map.of("family", "network")), 1e-9);
    }

    @Test
    void shouldRefreshCachedAggregatesWhenNewPointsArrive() {
        MutableClock clock = MutableClock.startingAt("2026-01-01T10:00:00Z");
        MetricsService metrics = new MetricsService(null, clock);
        Instant from = Instant.parse("2026-01-01T00:00:00Z");
        Instant to = Instant.parse("2026-01-02T00:00:00Z");
        metrics.increment(MetricNames.MODELS_PROMOTED);

        assertEquals(1, metrics.query(MetricNames.MODELS_PROMOTED, from, to, Granularity.DAY).get(0).count());
        metrics.increment(MetricNames.MODELS_PROMOTED);
        assertEquals(2, metrics.query(MetricNames.MODELS_PROMOTED, from, to, Granularity.DAY).get(0).count());
        assertThrows(IllegalArgumentException.class, () -> metrics.query(MetricNames.MODELS_PROMOTED, to, from, Granularity.DAY));
    }

    @Test
    void shouldBoundCachedQueriesPerMetric() {
        MutableClock clock = MutableClock.startingAt("2026-01-01T10:00:00Z");
        MetricsService metrics = new MetricsService(null, clock);
        metrics.increment(MetricNames.FEEDBACK_TOTAL);
        Instant to = Instant.parse("2026-01-02T00:00:00Z");

        for (int minute = 0; minute < 500; minute++) {
            Instant from = Instant.parse("2026-01-01T00:00:00Z").plus(Duration.ofMinutes(minute));
            assertEquals(1, metrics.query(MetricNames.FEEDBACK_TOTAL, from, to, Granularity.DAY).size());
        }

        assertEquals(MetricsService.MAX_CACHED_QUERIES, metrics.cachedQueryCount(MetricNames.FEEDBACK_TOTAL));
        metrics.increment(MetricNames.FEEDBACK_TOTAL);
        assertEquals(0, metrics.cachedQueryCount(MetricNames.FEEDBACK_TOTAL));
    }

    @Test
    void shouldFireAlertOncePerCooldown() {
        MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        MetricsService metrics = new MetricsService(null, clock);
        List<AlertEvent> delivered = new ArrayList<>();
        metrics.addSink(delivered::add);
        metrics.configureAlert(new AlertRule("cycle-failures", MetricNames.CYCLES_FAILED, Map.of(), AlertComparator.GREATER_OR_EQUAL, 2,
                AlertSeverity.HIGH, Duration.ofMinutes(30), Duration.ofMinutes(10), AggregateFunction.SUM));

        metrics.increment(MetricNames.CYCLES_FAILED);
        assertTrue(metrics.evaluateAlerts().isEmpty());

        metrics.increment(MetricNames.CYCLES_FAILED);
        assertEquals(1, metrics.evaluateAlerts().size());
        clock.advance(Duration.ofMinutes(5));
        metrics.increment(MetricNames.CYCLES_FAILED);
        assertTrue(metrics.evaluateAlerts().isEmpty(), "cooldown suppresses repeat alerts");

        clock.advance(Duration.ofMinutes(26));
        metrics.increment(MetricNames.CYCLES_FAILED);
        metrics.increment(MetricNames.CYCLES_FAILED);
        assertEquals(1, metrics.evaluateAlerts().size());

        assertEquals(2, delivered.size());
        assertEquals(AlertSeverity.HIGH, delivered.get(0).severity());
        assertEquals(2.0, delivered.get(0).observedValue(), 0.0);
        assertEquals(2, metrics.alertHistory().size());
    }

    @Test
    void shouldKeepDeliveringWhenOneSinkFails() {
        MetricsService metrics = new MetricsService(null, MutableClock.startingAt("2026-01-01T00:00:00Z"));
        List<AlertEvent> delivered = new ArrayList<>();
        metrics.addSink(event -> {
            throw new java.io.IOException("endpoint down");
        });
        metrics.addSink(delivered::add);

        metrics.raiseAlert("abtest.safety_violation", AlertSeverity.CRITICAL, "treatment degraded resolution", Map.of("test", "ab-x-0001"));

        assertEquals(1, delivered.size());
        assertEquals("ab-x-0001", delivered.get(0).tags().get("test"));
    }

    @Test
    void shouldReloadJournaledPoints() throws Exception {
        Path journal = tempDir.resolve("metrics.jsonl");
        MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        MetricsService first = MetricsService.withJournal(journal, clock);
        first.increment(MetricNames.FEEDBACK_TOTAL, Map.of("source", "operator"));
        first.gauge(MetricNames.FEEDBACK_SATISFACTION, 4.2);

        MetricsService reloaded = MetricsService.withJournal(journal, clock);

        assertEquals(1.0, reloaded.total(MetricNames.FEEDBACK_TOTAL, Map.of("source", "operator")), 0.0);
        assertEquals(4.2, reloaded.latest(MetricNames.FEEDBACK_SATISFACTION, Map.of()).orElseThrow().value(), 0.0);
        assertEquals(2, reloaded.snapshot().size());
    }
}

package com.incidentlearn.metrics;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetricsExporterTest {
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final List<MetricPoint> points = List.of(
            new MetricPoint(MetricNames.MODELS_PROMOTED, 1.0, Map.of("family", "network", "kind", "bootstrap"), T0),
            new MetricPoint(MetricNames.ABTESTS_ACTIVE, 2.0, Map.of(), T0),
            new MetricPoint(MetricNames.ABTESTS_ACTIVE, 1.0, Map.of(), T0.plusSeconds(60)));

    @Test
    void shouldExportCsvWithSortedTags() throws Exception {
        String csv = new MetricsExporter().export(points, MetricsExporter.Format.csv);

        String[] lines = csv.split("\n");
        assertEquals("name,value,timestamp,tags", lines[0]);
        assertEquals(4, lines.length);
        assertEquals("models.promoted_count,1.0,2026-01-01T00:00:00Z,\"family=network;kind=bootstrap\"", lines[1]);
    }

    @Test
    void shouldExportLatestValuePerSeriesForPrometheus() throws Exception {
        String text = new MetricsExporter().export(points, MetricsExporter.Format.prometheus);

        assertTrue(text.contains("# TYPE models_promoted_count gauge"));
        assertTrue(text.contains("models_promoted_count{family=\"network\",kind=\"bootstrap\"} 1.0 " + T0.toEpochMilli()));
        assertTrue(text.contains("abtests_active_count 1.0 " + T0.plusSeconds(60).toEpochMilli()));
        assertFalse(text.contains("abtests_active_count 2.0"));
    }

    @Test
    void shouldExportJsonArray() throws Exception {
        String json = new MetricsExporter().export(points, MetricsExporter.Format.json);

        assertTrue(json.trim().startsWith("["));
        assertTrue(json.contains("\"name\" : \"abtests.active_count\""));
    }
}

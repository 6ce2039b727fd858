package com.incidentlearn.metrics;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class MetricsExporter {
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();

    public enum Format {
        json,
        csv,
        prometheus
    }

    public String export(List<MetricPoint> points, Format format) throws IOException {
        return switch (format) {
            case json -> mapper.writerWithDefaultPrettyPrinter().writeValueAsString(points);
            case csv -> toCsv(points);
            case prometheus -> toPrometheus(points);
        };
    }

    private String toCsv(List<MetricPoint> points) {
        StringBuilder out = new StringBuilder("name,value,timestamp,tags\n");
        for (MetricPoint point : points) {
            String tags = point.tags().entrySet().stream()
                    .map(entry -> entry.getKey() + "=" + entry.getValue())
                    .sorted()
                    .collect(Collectors.joining(";"));
            out.append(point.name()).append(',')
                    .append(point.value()).append(',')
                    .append(point.timestamp()).append(',')
                    .append('"').append(tags.replace("\"", "\"\"")).append('"')
                    .append('\n');
        }
        return out.toString();
    }

    /** Latest value per series in the Prometheus text exposition format. */
    private String toPrometheus(List<MetricPoint> points) {
        Map<String, MetricPoint> latestBySeries = new LinkedHashMap<>();
        for (MetricPoint point : points) {
            latestBySeries.merge(point.seriesKey(), point,
                    (current, candidate) -> candidate.timestamp().isBefore(current.timestamp()) ? current : candidate);
        }
        Map<String, List<MetricPoint>> byName = latestBySeries.values().stream()
                .collect(Collectors.groupingBy(point -> sanitize(point.name()), LinkedHashMap::new, Collectors.toList()));
        StringBuilder out = new StringBuilder();
        byName.forEach((name, series) -> {
            out.append("# TYPE ").append(name).append(" gauge\n");
            for (MetricPoint point : series) {
                out.append(name);
                if (!point.tags().isEmpty()) {
                    out.append('{');
                    out.append(point.tags().entrySet().stream()
                            .sorted(Map.Entry.comparingByKey())
                            .map(entry -> sanitize(entry.getKey()) + "=\"" + entry.getValue().replace("\"", "\\\"") + "\"")
                            .collect(Collectors.joining(",")));
                    out.append('}');
                }
                out.append(' ').append(String.format(Locale.ROOT, "%s", point.value()))
                        .append(' ').append(point.timestamp().toEpochMilli())
                        .append('\n');
            }
        });
        return out.toString();
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_:]", "_");
    }
}

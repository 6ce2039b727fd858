package com.incidentlearn.metrics;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

public record MetricPoint(String name, double value, Map<String, String> tags, Instant timestamp) {
    public MetricPoint {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("metric name is required");
        }
        Objects.requireNonNull(timestamp, "timestamp");
        tags = tags == null ? Map.of() : Map.copyOf(new TreeMap<>(tags));
    }

    public boolean matches(Map<String, String> filter) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, String> entry : filter.entrySet()) {
            if (!entry.getValue().equals(tags.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    /** Series key in the form {@code name|k1=v1,k2=v2} with tags sorted by key. */
    public String seriesKey() {
        if (tags.isEmpty()) {
            return name;
        }
        StringBuilder builder = new StringBuilder(name).append('|');
        boolean first = true;
        for (Map.Entry<String, String> entry : new TreeMap<>(tags).entrySet()) {
            if (!first) {
                builder.append(',');
            }
            builder.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return builder.toString();
    }
}

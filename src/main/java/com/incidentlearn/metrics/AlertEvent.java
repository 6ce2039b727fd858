package com.incidentlearn.metrics;

import java.time.Instant;
import java.util.Map;

public record AlertEvent(
        String ruleName,
        String metricName,
        AlertSeverity severity,
        double observedValue,
        double threshold,
        AlertComparator comparator,
        String message,
        Map<String, String> tags,
        Instant triggeredAt) {
}

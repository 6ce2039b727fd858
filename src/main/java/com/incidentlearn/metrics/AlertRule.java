package com.incidentlearn.metrics;

import java.time.Duration;
import java.util.Map;

public record AlertRule(
        String name,
        String metricName,
        Map<String, String> tags,
        AlertComparator comparator,
        double threshold,
        AlertSeverity severity,
        Duration cooldown,
        Duration window,
        AggregateFunction aggregation) {

    public static final Duration DEFAULT_COOLDOWN = Duration.ofMinutes(5);
    public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(5);

    public AlertRule {
        if (metricName == null || metricName.isBlank()) {
            throw new IllegalArgumentException("alert rule requires a metric name");
        }
        if (comparator == null) {
            throw new IllegalArgumentException("alert rule requires a comparator");
        }
        name = name == null || name.isBlank() ? metricName + " " + comparator.symbol() + " " + threshold : name;
        tags = tags == null ? Map.of() : Map.copyOf(tags);
        severity = severity == null ? AlertSeverity.MEDIUM : severity;
        cooldown = cooldown == null ? DEFAULT_COOLDOWN : cooldown;
        window = window == null ? DEFAULT_WINDOW : window;
        aggregation = aggregation == null ? AggregateFunction.AVG : aggregation;
        if (cooldown.isNegative() || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("alert rule cooldown must be >= 0 and window > 0");
        }
    }

    public static AlertRule of(String metricName, AlertComparator comparator, double threshold, AlertSeverity severity) {
        return new AlertRule(null, metricName, Map.of(), comparator, threshold, severity, null, null, null);
    }
}

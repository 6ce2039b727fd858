package com.incidentlearn.metrics;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Append-only metric point store with aggregation on read and threshold alerting.
 *
 * <p>Aggregates are computed lazily per query and cached until a new point arrives for the same metric. Each metric
 * keeps at most {@link #MAX_CACHED_QUERIES} query results, least recently used first out.
 */
public class MetricsService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MetricsService.class);
    static final int MAX_CACHED_QUERIES = 64;

    private final Map<String, Queue<MetricPoint>> points = new ConcurrentHashMap<>();
    private final Map<String, Map<QueryKey, List<MetricAggregate>>> aggregateCache = new ConcurrentHashMap<>();
    private final Map<String, AlertRule> rules = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastFiredAt = new ConcurrentHashMap<>();
    private final List<AlertSink> sinks = new CopyOnWriteArrayList<>();
    private final List<AlertEvent> alertHistory = new CopyOnWriteArrayList<>();
    private final Path journalPath;
    private final Clock clock;
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();
    private ScheduledExecutorService scheduler;

    public MetricsService() {
        this(null, Clock.systemUTC());
    }

    public MetricsService(Path journalPath, Clock clock) {
        this.journalPath = journalPath;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Loads previously journaled points into memory. */
    public static MetricsService withJournal(Path journalPath, Clock clock) throws IOException {
        MetricsService service = new MetricsService(journalPath, clock);
        if (Files.exists(journalPath)) {
            for (String line : Files.readAllLines(journalPath)) {
                if (line == null || line.isBlank()) {
                    continue;
                }
                MetricPoint point = service.mapper.readValue(line, MetricPoint.class);
                service.points.computeIfAbsent(point.name(), ignored -> new ConcurrentLinkedQueue<>()).add(point);
            }
        }
        return service;
    }

    public Clock clock() {
        return clock;
    }

    public void addSink(AlertSink sink) {
        sinks.add(Objects.requireNonNull(sink, "sink"));
    }

    public MetricPoint record(String name, double value, Map<String, String> tags) {
        return record(new MetricPoint(name, value, tags, clock.instant()));
    }

    public MetricPoint record(MetricPoint point) {
        Objects.requireNonNull(point, "point");
        points.computeIfAbsent(point.name(), ignored -> new ConcurrentLinkedQueue<>()).add(point);
        aggregateCache.remove(point.name());
        journal(point);
        return point;
    }

    public MetricPoint increment(String name) {
        return increment(name, Map.of());
    }

    public MetricPoint increment(String name, Map<String, String> tags) {
        return record(name, 1.0, tags);
    }

    public MetricPoint gauge(String name, double value) {
        return record(name, value, Map.of());
    }

    public MetricPoint recordDuration(String name, Duration duration, Map<String, String> tags) {
        return record(name, duration.toMillis(), tags);
    }

    public List<MetricAggregate> query(String name, Instant from, Instant to, Granularity granularity) {
        return query(name, Map.of(), from, to, granularity);
    }

    /** Bucketed aggregates of points in {@code [from, to)}; empty buckets are omitted. */
    public List<MetricAggregate> query(String name, Map<String, String> tags, Instant from, Instant to, Granularity granularity) {
        Objects.requireNonNull(granularity, "granularity");
        if (!from.isBefore(to)) {
            throw new IllegalArgumentException("query window start must be before end");
        }
        QueryKey key = new QueryKey(tags == null ? Map.of() : Map.copyOf(tags), from, to, granularity);
        Map<QueryKey, List<MetricAggregate>> cached = aggregateCache.computeIfAbsent(name, ignored -> boundedCache());
        synchronized (cached) {
            List<MetricAggregate> hit = cached.get(key);
            if (hit != null) {
                return hit;
            }
        }
        List<MetricAggregate> computed = aggregate(name, key);
        synchronized (cached) {
            cached.put(key, computed);
        }
        return computed;
    }

    int cachedQueryCount(String name) {
        Map<QueryKey, List<MetricAggregate>> cached = aggregateCache.get(name);
        if (cached == null) {
            return 0;
        }
        synchronized (cached) {
            return cached.size();
        }
    }

    private static Map<QueryKey, List<MetricAggregate>> boundedCache() {
        return new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<QueryKey, List<MetricAggregate>> eldest) {
                return size() > MAX_CACHED_QUERIES;
            }
        };
    }

    public List<MetricPoint> points(String name, Map<String, String> tags, Instant from, Instant to) {
        Queue<MetricPoint> series = points.get(name);
        if (series == null) {
            return List.of();
        }
        List<MetricPoint> matched = new ArrayList<>();
        for (MetricPoint point : series) {
            if (!point.timestamp().isBefore(from) && point.timestamp().isBefore(to) && point.matches(tags)) {
                matched.add(point);
            }
        }
        matched.sort(Comparator.comparing(MetricPoint::timestamp));
        return matched;
    }

    public List<MetricPoint> snapshot() {
        List<MetricPoint> all = new ArrayList<>();
        points.values().forEach(all::addAll);
        all.sort(Comparator.comparing(MetricPoint::name).thenComparing(MetricPoint::timestamp));
        return all;
    }

    public double total(String name) {
        return total(name, Map.of());
    }

    public double total(String name, Map<String, String> tags) {
        Queue<MetricPoint> series = points.get(name);
        if (series == null) {
            return 0.0;
        }
        double sum = 0;
        for (MetricPoint point : series) {
            if (point.matches(tags)) {
                sum += point.value();
            }
        }
        return sum;
    }

    public Optional<MetricPoint> latest(String name, Map<String, String> tags) {
        Queue<MetricPoint> series = points.get(name);
        if (series == null) {
            return Optional.empty();
        }
        return series.stream()
                .filter(point -> point.matches(tags))
                .max(Comparator.comparing(MetricPoint::timestamp));
    }

    public void configureAlert(AlertRule rule) {
        Objects.requireNonNull(rule, "rule");
        rules.put(rule.name(), rule);
        log.info("alert.configured rule={} metric={} condition={}{}", rule.name(), rule.metricName(), rule.comparator().symbol(), rule.threshold());
    }

    public boolean removeAlert(String ruleName) {
        lastFiredAt.remove(ruleName);
        return rules.remove(ruleName) != null;
    }

    public List<AlertRule> alertRules() {
        return List.copyOf(new TreeMap<>(rules).values());
    }

    public List<AlertEvent> alertHistory() {
        return List.copyOf(alertHistory);
    }

    /** Evaluates every rule over its trailing window, firing at most once per cooldown per rule. */
    public List<AlertEvent> evaluateAlerts() {
        Instant now = clock.instant();
        List<AlertEvent> fired = new ArrayList<>();
        for (AlertRule rule : alertRules()) {
            List<MetricPoint> window = points(rule.metricName(), rule.tags(), now.minus(rule.window()), now.plusNanos(1));
            if (window.isEmpty()) {
                continue;
            }
            MetricAggregate aggregate = MetricAggregate.of(now, window.stream().map(MetricPoint::value).toList());
            double observed = aggregate.value(rule.aggregation());
            if (!rule.comparator().test(observed, rule.threshold())) {
                continue;
            }
            Instant last = lastFiredAt.get(rule.name());
            if (last != null && now.isBefore(last.plus(rule.cooldown()))) {
                log.debug("alert.suppressed rule={} cooldownUntil={}", rule.name(), last.plus(rule.cooldown()));
                continue;
            }
            lastFiredAt.put(rule.name(), now);
            String message = String.format("%s %s of %s is %.4f (threshold %s %.4f)",
                    rule.aggregation(), rule.window(), rule.metricName(), observed, rule.comparator().symbol(), rule.threshold());
            AlertEvent event = new AlertEvent(rule.name(), rule.metricName(), rule.severity(), observed, rule.threshold(),
                    rule.comparator(), message, rule.tags(), now);
            dispatch(event);
            fired.add(event);
        }
        return fired;
    }

    /** Raises an alert outside of rule evaluation, e.g. for a safety violation. */
    public AlertEvent raiseAlert(String name, AlertSeverity severity, String message, Map<String, String> tags) {
        AlertEvent event = new AlertEvent(name, name, severity, Double.NaN, Double.NaN, null, message,
                tags == null ? Map.of() : Map.copyOf(tags), clock.instant());
        dispatch(event);
        return event;
    }

    public synchronized void start(Duration evaluationInterval) {
        if (scheduler != null) {
            return;
        }
        long intervalMs = Math.max(1L, evaluationInterval.toMillis());
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "metrics-alerts");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleAtFixedRate(this::evaluateAlertsSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("alert.scheduler.started intervalMs={}", intervalMs);
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    private void evaluateAlertsSafely() {
        try {
            evaluateAlerts();
        } catch (RuntimeException e) {
            log.error("alert.evaluation.failed reason={}", e.getMessage(), e);
        }
    }

    private void dispatch(AlertEvent event) {
        alertHistory.add(event);
        for (AlertSink sink : sinks) {
            try {
                sink.deliver(event);
            } catch (IOException e) {
                log.warn("alert.delivery.failed rule={} sink={} reason={}", event.ruleName(), sink.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    private List<MetricAggregate> aggregate(String name, QueryKey key) {
        Map<Instant, List<Double>> buckets = new TreeMap<>();
        for (MetricPoint point : points(name, key.tags(), key.from(), key.to())) {
            buckets.computeIfAbsent(key.granularity().bucketStart(point.timestamp()), ignored -> new ArrayList<>()).add(point.value());
        }
        List<MetricAggregate> series = new ArrayList<>();
        buckets.forEach((start, values) -> series.add(MetricAggregate.of(start, values)));
        return List.copyOf(series);
    }

    private void journal(MetricPoint point) {
        if (journalPath == null) {
            return;
        }
        try {
            synchronized (this) {
                if (journalPath.getParent() != null) {
                    Files.createDirectories(journalPath.getParent());
                }
                Files.writeString(journalPath, mapper.writeValueAsString(point) + System.lineSeparator(),
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            }
        } catch (IOException e) {
            log.warn("metrics.journal.failed metric={} reason={}", point.name(), e.getMessage());
        }
    }

    private record QueryKey(Map<String, String> tags, Instant from, Instant to, Granularity granularity) {
    }
}

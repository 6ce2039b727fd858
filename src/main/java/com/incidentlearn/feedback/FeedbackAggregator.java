package com.incidentlearn.feedback;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.incidentlearn.metrics.MetricNames;
import com.incidentlearn.metrics.MetricsService;

/**
 * Rolling window of normalized feedback, deduplicated by {@code (incident_id, source)} keeping the most recent record.
 * Every query re-reads the shared log, so feedback ingested by another process is visible on the next read.
 */
public class FeedbackAggregator {
    private static final Logger log = LoggerFactory.getLogger(FeedbackAggregator.class);
    private static final Pattern EMAIL_PATTERN = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");
    private static final Pattern PHONE_PATTERN = Pattern.compile("(?<![\\w+])(?:\\+?\\d[\\d()\\- ]{6,}\\d)(?!\\w)");

    private final FeedbackStore store;
    private final MetricsService metrics;
    private final Clock clock;
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();
    private double ratingSum;
    private long ratingCount;

    public FeedbackAggregator(FeedbackStore store, MetricsService metrics, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public synchronized FeedbackRecord record(FeedbackEvent event) throws IOException {
        FeedbackRecord record;
        try {
            record = event.toRecord(clock);
        } catch (InvalidRecordException e) {
            metrics.increment(MetricNames.FEEDBACK_REJECTED);
            throw e;
        }
        return record(record);
    }

    public synchronized FeedbackRecord record(FeedbackRecord record) throws IOException {
        Objects.requireNonNull(record, "record");
        FeedbackRecord normalized = record.actualSolution() == null
                ? record
                : record.withActualSolution(anonymize(record.actualSolution()));
        store.append(normalized);

        metrics.increment(MetricNames.FEEDBACK_TOTAL);
        metrics.increment(MetricNames.perSourceFeedback(normalized.source().wireName()));
        if (normalized.rating() != null) {
            ratingSum += normalized.rating();
            ratingCount++;
            metrics.gauge(MetricNames.FEEDBACK_SATISFACTION, ratingSum / ratingCount);
        }
        log.debug("feedback.recorded incident={} source={} outcome={}", normalized.incidentId(), normalized.source(), normalized.outcome());
        return normalized;
    }

    /** Reads a JSON-lines file of inbound events; malformed or invalid lines are counted and skipped. */
    public IngestReport ingest(Path eventsPath) throws IOException {
        int accepted = 0;
        List<String> rejected = new ArrayList<>();
        int lineNumber = 0;
        for (String line : Files.readAllLines(eventsPath)) {
            lineNumber++;
            if (line == null || line.isBlank()) {
                continue;
            }
            try {
                record(mapper.readValue(line, FeedbackEvent.class));
                accepted++;
            } catch (InvalidRecordException | JsonProcessingException e) {
                rejected.add("line " + lineNumber + ": " + e.getMessage());
                log.warn("feedback.rejected file={} line={} reason={}", eventsPath.getFileName(), lineNumber, e.getMessage());
            }
        }
        log.info("feedback.ingested file={} accepted={} rejected={}", eventsPath.getFileName(), accepted, rejected.size());
        return new IngestReport(accepted, rejected);
    }

    public List<FeedbackRecord> window(TimeWindow window) throws IOException {
        return window(window, false);
    }

    /** Records with {@code recorded_at} in the window, ordered by time; {@code unknown} outcomes only when requested. */
    public List<FeedbackRecord> window(TimeWindow window, boolean includeUnknown) throws IOException {
        Objects.requireNonNull(window, "window");
        return latest().values().stream()
                .filter(record -> window.contains(record.recordedAt()))
                .filter(record -> includeUnknown || record.resolved())
                .sorted(Comparator.comparing(FeedbackRecord::recordedAt).thenComparing(FeedbackRecord::incidentId))
                .toList();
    }

    public int size() throws IOException {
        return latest().size();
    }

    /**
     * Moves records older than {@code retention} to the archive log and returns how many were moved. Works on the
     * raw log, so superseded duplicates are archived along with the record that replaced them.
     */
    public synchronized int archiveExpired(Duration retention) throws IOException {
        Instant cutoff = clock.instant().minus(retention);
        List<FeedbackRecord> expired = store.archiveBefore(cutoff);
        if (expired.isEmpty()) {
            return 0;
        }
        metrics.record(MetricNames.FEEDBACK_ARCHIVED, expired.size(), Map.of());
        log.info("feedback.archived count={} cutoff={}", expired.size(), cutoff);
        return expired.size();
    }

    public String anonymize(String value) {
        if (value == null || value.isBlank()) {
            return value;
        }
        String hiddenEmails = EMAIL_PATTERN.matcher(value).replaceAll("[REDACTED_EMAIL]");
        return PHONE_PATTERN.matcher(hiddenEmails).replaceAll("[REDACTED_PHONE]");
    }

    private Map<DedupKey, FeedbackRecord> latest() throws IOException {
        Map<DedupKey, FeedbackRecord> latest = new LinkedHashMap<>();
        for (FeedbackRecord record : store.loadAll()) {
            latest.merge(new DedupKey(record.incidentId(), record.source()), record,
                    (current, candidate) -> candidate.recordedAt().isBefore(current.recordedAt()) ? current : candidate);
        }
        return latest;
    }

    private record DedupKey(String incidentId, FeedbackSource source) {
    }

    public record IngestReport(int accepted, List<String> rejected) {
    }
}

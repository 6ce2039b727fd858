package com.incidentlearn;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.incidentlearn.experiment.ABTest;
import com.incidentlearn.feedback.FeedbackAggregator;
import com.incidentlearn.metrics.Granularity;
import com.incidentlearn.metrics.MetricAggregate;
import com.incidentlearn.metrics.MetricPoint;
import com.incidentlearn.metrics.MetricsExporter;
import com.incidentlearn.model.ProductionPointer;
import com.incidentlearn.pipeline.CycleReport;
import com.incidentlearn.pipeline.CycleState;
import com.incidentlearn.pipeline.LearningCycleOrchestrator;
import com.incidentlearn.pipeline.LearningLoop;
import com.incidentlearn.runtime.AppConfig;
import com.incidentlearn.runtime.LearningPipeline;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "incident-learn",
        mixinStandardHelpOptions = true,
        version = "incident-learn 0.1.0",
        description = "Continuous improvement pipeline for incident-resolution models.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "status")
    Mode mode;

    @Option(names = "--family", description = "Model family; defaults to every configured family where that applies")
    String family;

    @Option(names = "--events", description = "JSON-lines file of feedback events for ingest mode")
    Path eventsPath;

    @Option(names = "--incidents", description = "JSON-lines file of incident observations to import in ingest mode")
    Path incidentsPath;

    @Option(names = "--test-id", description = "A/B test id for abort-test mode")
    String testId;

    @Option(names = "--model-id", description = "Model version id for force-promote mode")
    Long modelId;

    @Option(names = "--reason", description = "Audit reason for abort-test and force-promote")
    String reason;

    @Option(names = "--actor", description = "Operator recorded in the promotion audit log", defaultValue = "operator")
    String actor;

    @Option(names = "--metric", description = "Metric name for metrics mode")
    String metricName;

    @Option(names = "--since-hours", description = "Look-back window for metrics and export-metrics modes", defaultValue = "24")
    long sinceHours;

    @Option(names = "--granularity", description = "Aggregation bucket: ${COMPLETION-CANDIDATES}", defaultValue = "HOUR")
    Granularity granularity;

    @Option(names = "--format", description = "Export format: ${COMPLETION-CANDIDATES}", defaultValue = "json")
    MetricsExporter.Format format;

    @Option(names = "--output", description = "Write exported metrics to this file instead of stdout")
    Path outputPath;

    private final OkHttpClient httpClient = new OkHttpClient();
    Clock clock = Clock.systemUTC();

    enum Mode {
        cycle,
        daemon,
        ingest,
        status,
        abort_test,
        force_promote,
        pause,
        resume,
        evaluate,
        metrics,
        export_metrics
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).setCaseInsensitiveEnumValuesAllowed(true).execute(normalizeModes(args));
        System.exit(exitCode);
    }

    /** Accepts {@code --mode abort-test} as well as {@code --mode abort_test}. */
    static String[] normalizeModes(String[] args) {
        String[] normalized = args.clone();
        for (int i = 0; i < normalized.length; i++) {
            if ("--mode".equals(normalized[i]) && i + 1 < normalized.length) {
                normalized[i + 1] = normalized[i + 1].replace('-', '_');
            } else if (normalized[i].startsWith("--mode=")) {
                normalized[i] = normalized[i].replace('-', '_').replaceFirst("^__mode=", "--mode=");
            }
        }
        return normalized;
    }

    @Override
    public Integer call() throws Exception {
        String usageError = usageError();
        if (usageError != null) {
            log.error(usageError);
            return 2;
        }

        AppConfig config = loadConfig(Path.of(configPath));
        log.info("Starting incident-learn in {} mode", mode);
        log.info("Using config file: {} stateDir={}", configPath, config.getStorage().getStateDir());

        try (LearningPipeline pipeline = new LearningPipeline(config, clock, httpClient)) {
            if (family != null && !family.isBlank()) {
                try {
                    pipeline.orchestrator(family);
                } catch (IllegalArgumentException e) {
                    log.error(e.getMessage());
                    return 2;
                }
            }
            switch (mode) {
                case cycle -> runCycles(pipeline);
                case daemon -> runDaemon(pipeline);
                case ingest -> runIngest(pipeline);
                case status -> printStatus(pipeline);
                case abort_test -> {
                    ABTest aborted = familyOf(pipeline, testId).abortTest(testId, reason);
                    log.info("Aborted A/B test id={} family={} treatment={} rationale={}", aborted.id(), aborted.family(),
                            aborted.treatmentModelId(), aborted.rationale());
                }
                case force_promote -> {
                    String target = family != null ? family : pipeline.registry().require(modelId).family();
                    ProductionPointer pointer = pipeline.orchestrator(target).forcePromote(modelId, reason, actor);
                    log.info("Forced promotion family={} model={} pointerVersion={}", pointer.family(), pointer.modelId(), pointer.version());
                }
                case pause -> {
                    for (LearningCycleOrchestrator orchestrator : selected(pipeline)) {
                        orchestrator.pauseCycle();
                    }
                }
                case resume -> {
                    for (LearningCycleOrchestrator orchestrator : selected(pipeline)) {
                        orchestrator.resumeCycle();
                    }
                }
                case evaluate -> {
                    for (ABTest test : pipeline.experiments().evaluateAll()) {
                        log.info("A/B test id={} family={} state={} decision={}", test.id(), test.family(), test.state(), test.decision());
                    }
                }
                case metrics -> printMetric(pipeline);
                case export_metrics -> exportMetrics(pipeline);
            }
        }
        return 0;
    }

    private String usageError() {
        return switch (mode) {
            case ingest -> eventsPath == null && incidentsPath == null ? "--events or --incidents is required in ingest mode" : null;
            case abort_test -> testId == null || testId.isBlank() ? "--test-id is required in abort-test mode" : null;
            case force_promote -> {
                if (modelId == null) {
                    yield "--model-id is required in force-promote mode";
                }
                yield reason == null || reason.isBlank() ? "--reason is required in force-promote mode" : null;
            }
            case metrics -> metricName == null || metricName.isBlank() ? "--metric is required in metrics mode" : null;
            default -> null;
        };
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory()).findAndRegisterModules();
        return mapper.readValue(config.toFile(), AppConfig.class);
    }

    private List<LearningCycleOrchestrator> selected(LearningPipeline pipeline) {
        if (family == null || family.isBlank()) {
            return pipeline.orchestrators();
        }
        return List.of(pipeline.orchestrator(family));
    }

    private LearningCycleOrchestrator familyOf(LearningPipeline pipeline, String id) throws IOException {
        ABTest test = pipeline.experiments().find(id).orElseThrow(() -> new IllegalArgumentException("Unknown A/B test " + id));
        return pipeline.orchestrator(test.family());
    }

    private void runCycles(LearningPipeline pipeline) throws IOException, InterruptedException {
        for (LearningCycleOrchestrator orchestrator : selected(pipeline)) {
            CycleReport report = orchestrator.runCycle();
            log.info("Cycle family={} cycle={} phase={} outcome={} production={} rationale={}",
                    report.family(),
                    report.cycleId(),
                    report.phase(),
                    report.outcome(),
                    report.productionModelId(),
                    report.rationale());
        }
    }

    private void runDaemon(LearningPipeline pipeline) throws IOException, InterruptedException {
        pipeline.startBackgroundTasks();
        LearningLoop loop = pipeline.loop();
        Thread mainThread = Thread.currentThread();
        Thread hook = new Thread(() -> {
            loop.requestStop();
            mainThread.interrupt();
        }, "incident-learn-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            LearningLoop.LoopState state = loop.runLoop();
            log.info("Continuous mode finished status={} iterations={} outcomes={}", state.lastStatus, state.iterationsThisRun, state.lastOutcome);
        } catch (InterruptedException e) {
            log.info("Continuous mode interrupted; shutting down");
            Thread.currentThread().interrupt();
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("Shutdown already in progress: {}", e.getMessage());
            }
        }
    }

    private void runIngest(LearningPipeline pipeline) throws IOException {
        if (incidentsPath != null) {
            int imported = pipeline.corpus().importFrom(incidentsPath);
            log.info("Imported incidents count={} corpusSize={}", imported, pipeline.corpus().size());
        }
        if (eventsPath != null) {
            FeedbackAggregator.IngestReport report = pipeline.feedback().ingest(eventsPath);
            log.info("Ingested feedback accepted={} rejected={} windowSize={}", report.accepted(), report.rejected().size(),
                    pipeline.feedback().size());
            for (String rejection : report.rejected()) {
                log.warn("Rejected feedback event: {}", rejection);
            }
        }
    }

    private void printStatus(LearningPipeline pipeline) throws IOException {
        for (LearningCycleOrchestrator orchestrator : selected(pipeline)) {
            CycleState state = orchestrator.state();
            Optional<Long> production = orchestrator.currentProductionModel();
            log.info("Family {} production={} cycle={} phase={} paused={} lastOutcome={} windowMultiplier={} completed={} failed={}",
                    orchestrator.family(),
                    production.map(String::valueOf).orElse("none"),
                    state.cycleId,
                    state.phase,
                    state.paused,
                    state.lastOutcome,
                    state.windowMultiplier,
                    state.completedCycles,
                    state.failedCycles);
            if (state.rationale != null) {
                log.info("Family {} rationale: {}", orchestrator.family(), state.rationale);
            }
            for (ABTest test : pipeline.experiments().active(orchestrator.family())) {
                log.info("Family {} test={} state={} control={} treatment={} split={} endsAt={}",
                        orchestrator.family(),
                        test.id(),
                        test.state(),
                        test.controlModelId(),
                        test.treatmentModelId(),
                        String.format("%.2f", test.trafficSplit()),
                        test.endsAt());
            }
        }
    }

    private void printMetric(LearningPipeline pipeline) {
        Instant to = clock.instant();
        Instant from = to.minus(Duration.ofHours(sinceHours));
        Map<String, String> tags = family == null ? Map.of() : Map.of("family", family);
        List<MetricAggregate> buckets = pipeline.metrics().query(metricName, tags, from, to, granularity);
        if (buckets.isEmpty()) {
            log.info("No data for metric={} since={}", metricName, from);
        }
        for (MetricAggregate bucket : buckets) {
            log.info("{} bucket={} count={} sum={} avg={} p95={}",
                    metricName,
                    bucket.bucketStart(),
                    bucket.count(),
                    String.format("%.4f", bucket.sum()),
                    String.format("%.4f", bucket.avg()),
                    String.format("%.4f", bucket.p95()));
        }
    }

    private void exportMetrics(LearningPipeline pipeline) throws IOException {
        Instant from = clock.instant().minus(Duration.ofHours(sinceHours));
        List<MetricPoint> points = new ArrayList<>();
        for (MetricPoint point : pipeline.metrics().snapshot()) {
            if (!point.timestamp().isBefore(from)) {
                points.add(point);
            }
        }
        String rendered = new MetricsExporter().export(points, format);
        if (outputPath == null) {
            System.out.println(rendered);
            return;
        }
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputPath, rendered, StandardCharsets.UTF_8);
        log.info("Exported metrics count={} format={} path={}", points.size(), format, outputPath);
    }
}

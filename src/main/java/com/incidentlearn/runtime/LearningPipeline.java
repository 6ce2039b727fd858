package com.incidentlearn.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.incidentlearn.corpus.HashingTextEmbedder;
import com.incidentlearn.corpus.JsonIncidentCorpus;
import com.incidentlearn.experiment.ExperimentService;
import com.incidentlearn.experiment.ExperimentStore;
import com.incidentlearn.feedback.FeedbackAggregator;
import com.incidentlearn.feedback.FeedbackStore;
import com.incidentlearn.metrics.AlertRule;
import com.incidentlearn.metrics.LoggingAlertSink;
import com.incidentlearn.metrics.MetricsService;
import com.incidentlearn.metrics.WebhookAlertSink;
import com.incidentlearn.model.ModelRegistry;
import com.incidentlearn.model.PromotionAuditLog;
import com.incidentlearn.patterns.BaselineStore;
import com.incidentlearn.patterns.BehaviorShiftDetector;
import com.incidentlearn.patterns.CorrelationDetector;
import com.incidentlearn.patterns.NewClusterDetector;
import com.incidentlearn.patterns.PatternAnalyzer;
import com.incidentlearn.patterns.PatternDetector;
import com.incidentlearn.patterns.PatternStore;
import com.incidentlearn.patterns.TrendDetector;
import com.incidentlearn.patterns.VolumeAnomalyDetector;
import com.incidentlearn.pipeline.CycleGovernor;
import com.incidentlearn.pipeline.CycleSettings;
import com.incidentlearn.pipeline.CycleStateStore;
import com.incidentlearn.pipeline.DeploymentMonitor;
import com.incidentlearn.pipeline.LearningCycleOrchestrator;
import com.incidentlearn.pipeline.LearningLoop;
import com.incidentlearn.retraining.RetrainingEngine;
import com.incidentlearn.retraining.RetrainingPlanner;
import com.incidentlearn.retraining.TrainingDatasetBuilder;
import com.incidentlearn.training.LogisticRegressionTrainer;
import com.incidentlearn.training.ModelTrainer;
import com.incidentlearn.validation.ValidationGate;
import com.incidentlearn.validation.ValidationReportStore;

import okhttp3.OkHttpClient;

/**
 * Builds the shared stores and services from {@link AppConfig} and one orchestrator per configured model family.
 * Everything lives under {@code storage.stateDir}, so separate processes pointed at the same directory see the same
 * registry, experiments and cycle state.
 */
public class LearningPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LearningPipeline.class);

    private final AppConfig config;
    private final Path stateDir;
    private final Clock clock;
    private final MetricsService metrics;
    private final FeedbackAggregator feedback;
    private final JsonIncidentCorpus corpus;
    private final ModelRegistry registry;
    private final PromotionAuditLog auditLog;
    private final ExperimentService experiments;
    private final CycleGovernor governor;
    private final Map<String, LearningCycleOrchestrator> orchestrators = new LinkedHashMap<>();
    private final List<ExecutorService> executors = new ArrayList<>();

    public LearningPipeline(AppConfig config, Clock clock, OkHttpClient httpClient) throws IOException {
        this(config, clock, httpClient, new LogisticRegressionTrainer(config.getRetraining().getFeatureDimension()));
    }

    public LearningPipeline(AppConfig config, Clock clock, OkHttpClient httpClient, ModelTrainer trainer) throws IOException {
        this.config = config;
        this.clock = clock;
        this.stateDir = Path.of(config.getStorage().getStateDir());
        Files.createDirectories(stateDir);

        this.metrics = MetricsService.withJournal(stateDir.resolve("metrics.jsonl"), clock);
        metrics.addSink(new LoggingAlertSink());
        AppConfig.WebhookConfig webhook = config.getMetrics().getWebhook();
        if (webhook.isEnabled() && webhook.getUrl() != null && !webhook.getUrl().isBlank()) {
            String token = webhook.getBearerTokenEnv() == null ? null : System.getenv(webhook.getBearerTokenEnv());
            metrics.addSink(new WebhookAlertSink(httpClient, webhook.getUrl(), token));
        }
        for (AppConfig.AlertRuleConfig alert : config.getMetrics().getAlerts()) {
            AlertRule rule = alert.toRule();
            metrics.configureAlert(rule);
        }

        this.feedback = new FeedbackAggregator(new FeedbackStore(stateDir.resolve("feedback")), metrics, clock);
        this.corpus = new JsonIncidentCorpus(Path.of(config.getStorage().getCorpusPath()));
        this.registry = new ModelRegistry(stateDir.resolve("model-registry.json"), clock);
        this.auditLog = new PromotionAuditLog(stateDir.resolve("promotion-audit.jsonl"));
        this.experiments = new ExperimentService(new ExperimentStore(stateDir.resolve("experiments")), registry, metrics,
                config.getExperiment().toPolicy(), clock);
        AppConfig.GovernorConfig governorConfig = config.getGovernor();
        this.governor = new CycleGovernor(
                new CycleGovernor.GovernorPolicy(governorConfig.getMaxConsecutiveFailedCycles(),
                        Duration.ofMinutes(governorConfig.getSafetyCooldownMinutes())),
                stateDir.resolve("cycles"),
                stateDir.resolve("governor-incidents.jsonl"),
                clock);

        AppConfig.PatternsConfig patterns = config.getPatterns();
        AppConfig.RetrainingConfig retrainingConfig = config.getRetraining();
        AppConfig.ValidationConfig validationConfig = config.getValidation();
        ExecutorService detectorPool = track(Executors.newFixedThreadPool(Math.max(1, patterns.getDetectorThreads())));
        ExecutorService trainingPool = track(Executors.newFixedThreadPool(Math.max(1, retrainingConfig.getWorkerThreads())));
        ExecutorService validationPool = track(Executors.newFixedThreadPool(Math.max(1, validationConfig.getWorkerThreads())));

        List<PatternDetector> detectors = detectors(patterns);
        RetrainingPlanner planner = new RetrainingPlanner(retrainingConfig.hyperparameters(), config.getFeedback().getRetrainThreshold(),
                patterns.getMinPatternConfidence());
        ValidationGate gate = new ValidationGate(trainer, registry, new ValidationReportStore(stateDir.resolve("validation-reports")), metrics,
                validationConfig.toPolicy(retrainingConfig.getPrimaryMetric()), clock);
        CycleStateStore cycleStates = new CycleStateStore(stateDir.resolve("cycles"));
        CycleSettings settings = cycleSettings(config);
        TrainingDatasetBuilder datasetBuilder = new TrainingDatasetBuilder(corpus);

        if (config.getFamilies().isEmpty()) {
            throw new IllegalArgumentException("at least one model family must be configured");
        }
        for (AppConfig.FamilyConfig family : config.getFamilies()) {
            if (orchestrators.containsKey(family.getName())) {
                throw new IllegalArgumentException("duplicate model family " + family.getName());
            }
            RetrainingEngine engine = new RetrainingEngine(family.getName(), new LinkedHashSet<>(family.getCategories()), feedback, datasetBuilder,
                    trainer, registry, metrics, retrainingConfig.toPolicy(), stateDir.resolve("models").resolve(family.getName()), trainingPool,
                    clock);
            Path patternsDir = stateDir.resolve("patterns").resolve(family.getName());
            PatternAnalyzer patternAnalyzer = new PatternAnalyzer(
                    detectors,
                    new PatternStore(patternsDir.resolve("patterns.jsonl")),
                    new BaselineStore(patternsDir.resolve("baselines.json")),
                    metrics,
                    detectorPool,
                    Duration.ofMillis(patterns.getDetectorTimeoutMs()),
                    patterns.getBaselineSmoothing());
            DeploymentMonitor monitor = new DeploymentMonitor(family.getName(), new LinkedHashSet<>(family.getCategories()), trainer,
                    datasetBuilder, feedback, registry, metrics, config.getRollback().toPolicy(), clock);
            orchestrators.put(family.getName(), new LearningCycleOrchestrator(family.getName(), feedback, corpus, patternAnalyzer, planner,
                    engine, gate, experiments, registry, auditLog, metrics, cycleStates, governor, monitor, settings, validationPool));
        }
        log.info("pipeline.ready stateDir={} families={}", stateDir, orchestrators.keySet());
    }

    static CycleSettings cycleSettings(AppConfig config) {
        AppConfig.PatternsConfig patterns = config.getPatterns();
        AppConfig.RetrainingConfig retraining = config.getRetraining();
        return new CycleSettings(
                Duration.ofDays(retraining.getTrainingWindowDays()),
                Duration.ofDays(patterns.getAnalysisWindowDays()),
                Duration.ofHours(patterns.getRecentWindowHours()),
                Duration.ofDays(config.getFeedback().getRetentionDays()),
                retraining.getMaxWindowMultiplier(),
                Duration.ofMillis(config.getValidation().getTimeoutMs()),
                config.getExperiment().getMaxAttempts(),
                config.getContinuous().getMaxRetries(),
                config.getContinuous().getRetryBackoffMs());
    }

    private static List<PatternDetector> detectors(AppConfig.PatternsConfig patterns) {
        return List.of(
                new NewClusterDetector(new HashingTextEmbedder(patterns.getEmbeddingDimension()), patterns.getNoveltyDistance(),
                        patterns.getMinClusterNeighbors(), Duration.ofHours(patterns.getClusterTimeSpanHours()), patterns.getClusterRadius()),
                new BehaviorShiftDetector(patterns.getShiftThreshold(), patterns.getShiftMinSamples()),
                new TrendDetector(patterns.getTrendSignificance(), patterns.getTrendMinRelativeSlope(), patterns.getTrendMinPoints(),
                        Duration.ofHours(patterns.getTrendBucketHours()), patterns.getTrendProjectionBuckets()),
                new CorrelationDetector(patterns.getCorrelationThreshold(), patterns.getCorrelationMinSupport(),
                        Duration.ofHours(patterns.getCorrelationBucketHours())),
                new VolumeAnomalyDetector(patterns.getAnomalyZThreshold(), Duration.ofMinutes(patterns.getAnomalyBucketMinutes()),
                        patterns.getAnomalyMinBuckets()));
    }

    /** Continuous mode over every family, with one worker per family. */
    public LearningLoop loop() {
        AppConfig.ContinuousModeConfig continuous = config.getContinuous();
        ExecutorService familyPool = track(Executors.newFixedThreadPool(orchestrators.size()));
        return new LearningLoop(List.copyOf(orchestrators.values()),
                new LearningLoop.LoopSettings(continuous.getCycleIntervalMs(), continuous.getExperimentPollIntervalMs(), continuous.getMaxCycles(),
                        continuous.getMaxRuntimeMs(), continuous.getIdleTimeoutMs()),
                familyPool, stateDir.resolve("loop-state.json"), clock);
    }

    /** Starts alert evaluation and the experiment scheduler for long-running processes. */
    public void startBackgroundTasks() {
        metrics.start(Duration.ofMillis(config.getMetrics().getAlertEvaluationIntervalMs()));
        experiments.startScheduler(Duration.ofMillis(config.getExperiment().getEvaluationIntervalMs()));
    }

    public LearningCycleOrchestrator orchestrator(String family) {
        LearningCycleOrchestrator orchestrator = orchestrators.get(family);
        if (orchestrator == null) {
            throw new IllegalArgumentException("Unknown model family " + family + "; configured: " + orchestrators.keySet());
        }
        return orchestrator;
    }

    public List<LearningCycleOrchestrator> orchestrators() {
        return List.copyOf(orchestrators.values());
    }

    public MetricsService metrics() {
        return metrics;
    }

    public FeedbackAggregator feedback() {
        return feedback;
    }

    public JsonIncidentCorpus corpus() {
        return corpus;
    }

    public ModelRegistry registry() {
        return registry;
    }

    public PromotionAuditLog auditLog() {
        return auditLog;
    }

    public ExperimentService experiments() {
        return experiments;
    }

    public CycleGovernor governor() {
        return governor;
    }

    private ExecutorService track(ExecutorService executor) {
        executors.add(executor);
        return executor;
    }

    @Override
    public void close() {
        experiments.close();
        metrics.close();
        for (ExecutorService executor : executors) {
            executor.shutdown();
        }
        for (ExecutorService executor : executors) {
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}

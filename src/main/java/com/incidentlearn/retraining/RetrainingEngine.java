package com.incidentlearn.retraining;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.incidentlearn.corpus.IncidentObservation;
import com.incidentlearn.feedback.FeedbackAggregator;
import com.incidentlearn.feedback.FeedbackRecord;
import com.incidentlearn.feedback.TimeWindow;
import com.incidentlearn.metrics.MetricNames;
import com.incidentlearn.metrics.MetricsService;
import com.incidentlearn.model.ModelRegistry;
import com.incidentlearn.model.ModelStatus;
import com.incidentlearn.model.ModelVersion;
import com.incidentlearn.training.ClassificationMetrics;
import com.incidentlearn.training.ModelTrainer;
import com.incidentlearn.training.OfflineMetrics;
import com.incidentlearn.training.PipelineTimeoutException;
import com.incidentlearn.training.StageBudget;
import com.incidentlearn.training.TrainingExample;
import com.incidentlearn.training.TrainingHyperparameters;
import com.incidentlearn.training.TrainingRunMetadata;

/**
 * Builds candidate models for one family from a feedback window: future slice, stratified train/holdout split,
 * k-fold cross validation on the training portion, a final fit, and registration as a candidate.
 */
public class RetrainingEngine {
    private static final Logger log = LoggerFactory.getLogger(RetrainingEngine.class);

    private final String family;
    private final Set<String> categories;
    private final FeedbackAggregator feedback;
    private final TrainingDatasetBuilder datasetBuilder;
    private final ModelTrainer trainer;
    private final CrossValidator crossValidator;
    private final ModelRegistry registry;
    private final MetricsService metrics;
    private final RetrainingPolicy policy;
    private final Path modelsDir;
    private final ExecutorService executor;
    private final Clock clock;
    private final AtomicLong runSequence = new AtomicLong();
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();

    public RetrainingEngine(
            String family,
            Set<String> categories,
            FeedbackAggregator feedback,
            TrainingDatasetBuilder datasetBuilder,
            ModelTrainer trainer,
            ModelRegistry registry,
            MetricsService metrics,
            RetrainingPolicy policy,
            Path modelsDir,
            ExecutorService executor,
            Clock clock) {
        this.family = Objects.requireNonNull(family, "family");
        this.categories = Set.copyOf(categories);
        this.feedback = Objects.requireNonNull(feedback, "feedback");
        this.datasetBuilder = Objects.requireNonNull(datasetBuilder, "datasetBuilder");
        this.trainer = Objects.requireNonNull(trainer, "trainer");
        this.crossValidator = new CrossValidator(trainer);
        this.registry = Objects.requireNonNull(registry, "registry");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.modelsDir = Objects.requireNonNull(modelsDir, "modelsDir");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Feedback about incidents in this family's categories; every record when no category is configured. */
    public List<FeedbackRecord> scope(List<FeedbackRecord> records) {
        return datasetBuilder.inCategories(records, categories);
    }

    public boolean covers(IncidentObservation incident) {
        return categories.isEmpty() || categories.contains(TrainingDatasetBuilder.categoryOf(incident));
    }

    public ModelVersion retrain(TimeWindow trainingWindow, Long baseModelId) throws IOException {
        return retrain(trainingWindow, baseModelId, TrainingHyperparameters.defaults());
    }

    public ModelVersion retrain(TimeWindow trainingWindow, Long baseModelId, TrainingHyperparameters hyperparameters) throws IOException {
        return train(prepare(trainingWindow), baseModelId, hyperparameters);
    }

    /**
     * Trains one candidate per configuration on the worker pool. A candidate that fails or exceeds the budget is
     * registered as rejected; the others are unaffected.
     *
     * @throws InsufficientDataException before any training when the window is too small
     */
    public List<ModelVersion> retrainCandidates(TimeWindow trainingWindow, Long baseModelId, List<TrainingHyperparameters> configurations)
            throws IOException, InterruptedException {
        if (configurations.isEmpty()) {
            throw new IllegalArgumentException("at least one hyperparameter configuration is required");
        }
        PreparedData prepared = prepare(trainingWindow);
        Map<TrainingHyperparameters, Future<ModelVersion>> futures = new LinkedHashMap<>();
        Map<TrainingHyperparameters, StageBudget> budgets = new LinkedHashMap<>();
        for (TrainingHyperparameters configuration : configurations) {
            budgets.put(configuration, StageBudget.startingNow("retraining", policy.timeout()));
            futures.put(configuration, executor.submit(() -> train(prepared, baseModelId, configuration)));
        }

        List<ModelVersion> versions = new ArrayList<>();
        for (Map.Entry<TrainingHyperparameters, Future<ModelVersion>> entry : futures.entrySet()) {
            try {
                versions.add(budgets.get(entry.getKey()).await(entry.getValue()));
            } catch (PipelineTimeoutException e) {
                log.warn("retraining.timeout family={} hyperparameters={} budget={}", family, entry.getKey(), policy.timeout());
                versions.add(rejectUnfinished(trainingWindow, baseModelId, entry.getKey(), e.getMessage()));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.warn("retraining.failed family={} hyperparameters={} reason={}", family, entry.getKey(), cause.getMessage(), cause);
                versions.add(rejectUnfinished(trainingWindow, baseModelId, entry.getKey(), "Retraining failed: " + cause.getMessage()));
            }
        }
        return versions;
    }

    /** Builds and splits the dataset; the minimum sample count applies to the training portion. */
    public PreparedData prepare(TimeWindow trainingWindow) throws IOException {
        List<FeedbackRecord> records = feedback.window(trainingWindow);
        List<TrainingExample> examples = datasetBuilder.build(records, categories);
        StratifiedSplitter.Split byTime = StratifiedSplitter.futureSlice(examples, policy.futureFraction());
        StratifiedSplitter.Split split = StratifiedSplitter.split(byTime.first(), policy.trainFraction(), TrainingHyperparameters.defaults().seed());
        if (split.first().size() < policy.minSamples()) {
            log.info("retraining.insufficient-data family={} window={} records={} training={} required={}",
                    family, trainingWindow, records.size(), split.first().size(), policy.minSamples());
            throw new InsufficientDataException(split.first().size(), policy.minSamples());
        }
        return new PreparedData(trainingWindow, new DatasetSnapshot(split.first(), split.second(), byTime.second()));
    }

    ModelVersion train(PreparedData prepared, Long baseModelId, TrainingHyperparameters hyperparameters) throws IOException {
        Instant startedAt = clock.instant();
        long started = System.nanoTime();
        String runId = "run-" + startedAt.toEpochMilli() + "-" + runSequence.incrementAndGet();
        Path runDir = modelsDir.resolve(family).resolve(runId);
        Files.createDirectories(runDir);
        DatasetSnapshot snapshot = prepared.snapshot();

        CrossValidator.Result cv = crossValidator.crossValidate(snapshot.training(), policy.folds(), hyperparameters, runDir.resolve("cv"));
        ModelTrainer.TrainingResult result = trainer.train(snapshot.training(), hyperparameters, runDir);
        ClassificationMetrics holdout = ClassificationMetrics.evaluate(result.model(), snapshot.holdout());
        OfflineMetrics offline = new OfflineMetrics(
                cv.estimate(ClassificationMetrics.ACCURACY),
                cv.estimate(ClassificationMetrics.PRECISION),
                cv.estimate(ClassificationMetrics.RECALL),
                cv.estimate(ClassificationMetrics.F1),
                cv.folds().size(),
                holdout,
                snapshot.training().size(),
                snapshot.holdout().size(),
                snapshot.future().size());

        if (Thread.currentThread().isInterrupted()) {
            throw new PipelineTimeoutException("retraining", policy.timeout());
        }
        Path datasetPath = runDir.resolve("dataset.json");
        snapshot.save(datasetPath);
        long durationMillis = (System.nanoTime() - started) / 1_000_000L;
        TrainingRunMetadata runMetadata = new TrainingRunMetadata(
                runId,
                startedAt,
                durationMillis,
                snapshot.hash(),
                snapshot.training().size(),
                snapshot.holdout().size(),
                snapshot.future().size(),
                hyperparameters,
                result.trainerName(),
                result.notes());
        mapper.writerWithDefaultPrettyPrinter().writeValue(runDir.resolve("training-run.json").toFile(), runMetadata);

        ModelVersion version = registry.registerCandidate(family, baseModelId, prepared.window(), hyperparameters, offline,
                result.artifactPath().toString(), datasetPath.toString());
        metrics.increment(MetricNames.MODELS_RETRAINED, Map.of("family", family));
        metrics.recordDuration(MetricNames.MODELS_TRAINING_DURATION, Duration.ofMillis(durationMillis), Map.of("family", family));

        double spread = offline.estimate(policy.primaryMetric()).stddev();
        if (spread > policy.stabilityThreshold()) {
            String rationale = String.format("Cross-fold %s stddev %.4f exceeds stability threshold %.4f",
                    policy.primaryMetric(), spread, policy.stabilityThreshold());
            metrics.increment(MetricNames.MODELS_REJECTED, Map.of("family", family, "stage", "retraining"));
            return registry.reject(version.id(), rationale);
        }
        log.info("retraining.candidate id={} family={} {}={}±{} holdout={}", version.id(), family, policy.primaryMetric(),
                String.format("%.4f", offline.estimate(policy.primaryMetric()).mean()), String.format("%.4f", spread),
                String.format("%.4f", holdout.accuracy()));
        return version;
    }

    private ModelVersion rejectUnfinished(TimeWindow window, Long baseModelId, TrainingHyperparameters hyperparameters, String reason)
            throws IOException {
        metrics.increment(MetricNames.MODELS_REJECTED, Map.of("family", family, "stage", "retraining"));
        return registry.registerRejected(family, baseModelId, window, hyperparameters, reason);
    }

    public static boolean isCandidate(ModelVersion version) {
        return version.status() == ModelStatus.CANDIDATE;
    }

    public record PreparedData(TimeWindow window, DatasetSnapshot snapshot) {
    }
}

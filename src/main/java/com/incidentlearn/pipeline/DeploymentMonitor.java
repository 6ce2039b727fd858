package com.incidentlearn.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.incidentlearn.feedback.FeedbackAggregator;
import com.incidentlearn.feedback.TimeWindow;
import com.incidentlearn.metrics.MetricNames;
import com.incidentlearn.metrics.MetricsService;
import com.incidentlearn.model.ModelRegistry;
import com.incidentlearn.model.ModelVersion;
import com.incidentlearn.model.ProductionPointer;
import com.incidentlearn.retraining.TrainingDatasetBuilder;
import com.incidentlearn.training.ClassificationMetrics;
import com.incidentlearn.training.CorruptArtifactException;
import com.incidentlearn.training.ModelTrainer;
import com.incidentlearn.training.TrainedModel;
import com.incidentlearn.training.TrainingExample;

/**
 * Scores the serving model of one family against the feedback that arrived since it was deployed.
 *
 * <p>A model is degraded when its live accuracy falls under an absolute floor, or drops further below its
 * cross-validated accuracy than the policy allows. An artifact that can no longer be loaded counts as degraded.
 */
public class DeploymentMonitor {
    private static final Logger log = LoggerFactory.getLogger(DeploymentMonitor.class);

    private final String family;
    private final Set<String> categories;
    private final ModelTrainer trainer;
    private final TrainingDatasetBuilder datasetBuilder;
    private final FeedbackAggregator feedback;
    private final ModelRegistry registry;
    private final MetricsService metrics;
    private final MonitorPolicy policy;
    private final Clock clock;

    public DeploymentMonitor(
            String family,
            Set<String> categories,
            ModelTrainer trainer,
            TrainingDatasetBuilder datasetBuilder,
            FeedbackAggregator feedback,
            ModelRegistry registry,
            MetricsService metrics,
            MonitorPolicy policy,
            Clock clock) {
        this.family = Objects.requireNonNull(family, "family");
        this.categories = Set.copyOf(categories);
        this.trainer = Objects.requireNonNull(trainer, "trainer");
        this.datasetBuilder = Objects.requireNonNull(datasetBuilder, "datasetBuilder");
        this.feedback = Objects.requireNonNull(feedback, "feedback");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public MonitorPolicy policy() {
        return policy;
    }

    /** Empty when monitoring is off, nothing is serving, or too little feedback has arrived to judge. */
    public Optional<HealthReport> check() throws IOException {
        if (!policy.enabled()) {
            return Optional.empty();
        }
        ProductionPointer pointer = registry.productionPointer(family);
        Optional<ModelVersion> serving = registry.currentProduction(family);
        Instant now = clock.instant();
        if (serving.isEmpty() || pointer.updatedAt() == null || pointer.updatedAt().isAfter(now)) {
            return Optional.empty();
        }
        ModelVersion version = serving.get();
        List<TrainingExample> examples = datasetBuilder.build(feedback.window(new TimeWindow(pointer.updatedAt(), now)), categories);
        if (examples.size() < policy.minSamples()) {
            log.debug("deployment.check.skipped family={} model={} samples={} minSamples={}", family, version.id(), examples.size(), policy.minSamples());
            return Optional.empty();
        }
        double offline = version.offlineMetrics() == null ? Double.NaN : version.offlineMetrics().accuracy().mean();
        if (version.artifactPath() == null) {
            return Optional.of(degraded(version, examples.size(), Double.NaN, offline, "Serving model has no artifact"));
        }

        TrainedModel model;
        try {
            model = trainer.load(Path.of(version.artifactPath()));
        } catch (CorruptArtifactException e) {
            return Optional.of(degraded(version, examples.size(), Double.NaN, offline, "Artifact failed integrity check: " + e.getMessage()));
        } catch (IOException e) {
            return Optional.of(degraded(version, examples.size(), Double.NaN, offline, "Artifact unreadable: " + e.getMessage()));
        }

        double live = ClassificationMetrics.evaluate(model, examples).accuracy();
        metrics.record(MetricNames.MODELS_LIVE_ACCURACY, live, Map.of("family", family, "model", String.valueOf(version.id())));
        HealthReport report;
        if (live < policy.minLiveAccuracy()) {
            report = degraded(version, examples.size(), live, offline,
                    String.format("Live accuracy %.3f below floor %.3f", live, policy.minLiveAccuracy()));
        } else if (!Double.isNaN(offline) && offline - live > policy.maxAccuracyDrop()) {
            report = degraded(version, examples.size(), live, offline,
                    String.format("Live accuracy %.3f dropped %.3f below offline %.3f (allowed %.3f)", live, offline - live, offline,
                            policy.maxAccuracyDrop()));
        } else {
            report = new HealthReport(version.id(), examples.size(), live, offline, false, "Serving model healthy");
        }
        log.info("deployment.checked family={} model={} samples={} liveAccuracy={} offlineAccuracy={} degraded={}", family, version.id(),
                report.samples(), live, offline, report.degraded());
        return Optional.of(report);
    }

    private HealthReport degraded(ModelVersion version, int samples, double live, double offline, String reason) {
        log.warn("deployment.degraded family={} model={} samples={} reason={}", family, version.id(), samples, reason);
        return new HealthReport(version.id(), samples, live, offline, true, reason);
    }

    public record MonitorPolicy(boolean enabled, int minSamples, double maxAccuracyDrop, double minLiveAccuracy) {
        public MonitorPolicy {
            if (minSamples < 1) {
                throw new IllegalArgumentException("minSamples must be positive");
            }
        }

        public static MonitorPolicy defaults() {
            return new MonitorPolicy(true, 30, 0.10, 0.6);
        }

        public static MonitorPolicy disabled() {
            return new MonitorPolicy(false, 1, 1.0, 0.0);
        }
    }

    /** {@code liveAccuracy} is NaN when the artifact could not be scored. */
    public record HealthReport(long modelId, int samples, double liveAccuracy, double offlineAccuracy, boolean degraded, String reason) {
    }
}

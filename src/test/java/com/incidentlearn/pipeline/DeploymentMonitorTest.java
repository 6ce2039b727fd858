package com.incidentlearn.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.incidentlearn.LearningFixtures;
import com.incidentlearn.MutableClock;
import com.incidentlearn.corpus.JsonIncidentCorpus;
import com.incidentlearn.feedback.FeedbackAggregator;
import com.incidentlearn.feedback.FeedbackStore;
import com.incidentlearn.feedback.TimeWindow;
import com.incidentlearn.metrics.MetricNames;
import com.incidentlearn.metrics.MetricsService;
import com.incidentlearn.model.ModelRegistry;
import com.incidentlearn.model.ModelStatus;
import com.incidentlearn.model.ModelVersion;
import com.incidentlearn.retraining.TrainingDatasetBuilder;
import com.incidentlearn.training.CorruptArtifactException;
import com.incidentlearn.training.MetricEstimate;
import com.incidentlearn.training.ModelTrainer;
import com.incidentlearn.training.OfflineMetrics;
import com.incidentlearn.training.TrainedModel;
import com.incidentlearn.training.TrainingExample;
import com.incidentlearn.training.TrainingHyperparameters;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeploymentMonitorTest {
    @TempDir
    Path tempDir;

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T00:00:00Z");
    private final MetricsService metrics = new MetricsService(null, clock);
    private FeedbackAggregator feedback;
    private JsonIncidentCorpus corpus;
    private ModelRegistry registry;

    @BeforeEach
    void setUp() throws Exception {
        feedback = new FeedbackAggregator(new FeedbackStore(tempDir.resolve("feedback")), metrics, clock);
        corpus = new JsonIncidentCorpus(tempDir.resolve("incidents.json"));
        registry = new ModelRegistry(tempDir.resolve("registry.json"), clock);
    }

    @Test
    void shouldReportHealthyModelAndRecordLiveAccuracy() throws Exception {
        ModelVersion serving = deploy("model.bin", 0.95);
        LearningFixtures.seedSeparable(feedback, corpus, 40, clock.instant().plusSeconds(60));
        clock.advance(Duration.ofHours(2));

        DeploymentMonitor.HealthReport report = monitor(DeploymentMonitor.MonitorPolicy.defaults()).check().orElseThrow();

        assertFalse(report.degraded(), report.reason());
        assertEquals(serving.id(), report.modelId());
        assertEquals(40, report.samples());
        assertEquals(1.0, report.liveAccuracy(), 1e-9);
        assertEquals(1.0, metrics.latest(MetricNames.MODELS_LIVE_ACCURACY, Map.of("family", "default")).orElseThrow().value(), 1e-9);
    }

    @Test
    void shouldFlagModelWhoseLiveAccuracyFallsBelowFloor() throws Exception {
        deploy("model.bin", 0.95);
        LearningFixtures.seedRegressed(feedback, corpus, 40, clock.instant().plusSeconds(60));
        clock.advance(Duration.ofHours(2));

        DeploymentMonitor.HealthReport report = monitor(DeploymentMonitor.MonitorPolicy.defaults()).check().orElseThrow();

        assertTrue(report.degraded());
        assertEquals(0.0, report.liveAccuracy(), 1e-9);
        assertTrue(report.reason().contains("below floor"), report.reason());
    }

    @Test
    void shouldFlagModelThatDropsTooFarBelowOfflineAccuracy() throws Exception {
        deploy("model.bin", 0.95);
        LearningFixtures.seedSeparable(feedback, corpus, 32, clock.instant().plusSeconds(60));
        LearningFixtures.seedRegressed(feedback, corpus, 8, clock.instant().plus(Duration.ofHours(1)));
        clock.advance(Duration.ofHours(2));

        DeploymentMonitor.HealthReport report = monitor(DeploymentMonitor.MonitorPolicy.defaults()).check().orElseThrow();

        assertEquals(0.8, report.liveAccuracy(), 1e-9);
        assertTrue(report.degraded());
        assertTrue(report.reason().contains("below offline"), report.reason());
    }

    @Test
    void shouldIgnoreFeedbackFromBeforeDeploymentAndWaitForEnoughSamples() throws Exception {
        LearningFixtures.seedRegressed(feedback, corpus, 40, clock.instant().minus(Duration.ofDays(1)));
        deploy("model.bin", 0.95);
        LearningFixtures.seedSeparable(feedback, corpus, 10, clock.instant().plusSeconds(60));
        clock.advance(Duration.ofHours(2));

        assertTrue(monitor(DeploymentMonitor.MonitorPolicy.defaults()).check().isEmpty());
        assertTrue(monitor(DeploymentMonitor.MonitorPolicy.disabled()).check().isEmpty());
    }

    @Test
    void shouldTreatUnloadableArtifactAsDegraded() throws Exception {
        deploy("corrupt.bin", 0.95);
        LearningFixtures.seedSeparable(feedback, corpus, 40, clock.instant().plusSeconds(60));
        clock.advance(Duration.ofHours(2));

        DeploymentMonitor.HealthReport report = monitor(DeploymentMonitor.MonitorPolicy.defaults()).check().orElseThrow();

        assertTrue(report.degraded());
        assertTrue(Double.isNaN(report.liveAccuracy()));
        assertTrue(report.reason().contains("integrity"), report.reason());
    }

    private DeploymentMonitor monitor(DeploymentMonitor.MonitorPolicy policy) {
        return new DeploymentMonitor("default", Set.of(), new KeywordTrainer(), new TrainingDatasetBuilder(corpus), feedback, registry,
                metrics, policy, clock);
    }

    private ModelVersion deploy(String artifact, double offlineAccuracy) throws IOException {
        MetricEstimate accuracy = new MetricEstimate(offlineAccuracy, 0.01);
        OfflineMetrics offline = new OfflineMetrics(accuracy, accuracy, accuracy, accuracy, 5, null, 100, 20, 10);
        ModelVersion candidate = registry.registerCandidate("default", null, TimeWindow.trailing(clock.instant(), Duration.ofDays(30)),
                TrainingHyperparameters.defaults(), offline, tempDir.resolve(artifact).toString(), null);
        registry.transition(candidate.id(), ModelStatus.GATED, "validated");
        registry.transition(candidate.id(), ModelStatus.EXPERIMENTING, "bootstrap");
        registry.promote("default", null, candidate.id(), "bootstrap");
        return registry.require(candidate.id());
    }

    /** Predicts success for connection-pool incidents, the pattern the separable fixtures resolve. */
    private static class KeywordTrainer implements ModelTrainer {
        @Override
        public String name() {
            return "keyword";
        }

        @Override
        public TrainingResult train(List<TrainingExample> dataset, TrainingHyperparameters hyperparameters, Path runDirectory) {
            throw new UnsupportedOperationException("not used");
        }

        @Override
        public TrainedModel load(Path artifactPath) {
            if (artifactPath.getFileName().toString().startsWith("corrupt")) {
                throw new CorruptArtifactException("checksum mismatch for " + artifactPath.getFileName());
            }
            return example -> example.text().contains("connection pool") ? 1.0 : 0.0;
        }
    }
}

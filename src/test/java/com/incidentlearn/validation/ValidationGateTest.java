package com.incidentlearn.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.incidentlearn.MutableClock;
import com.incidentlearn.feedback.TimeWindow;
import com.incidentlearn.metrics.MetricNames;
import com.incidentlearn.metrics.MetricsService;
import com.incidentlearn.model.ModelRegistry;
import com.incidentlearn.model.ModelStatus;
import com.incidentlearn.model.ModelVersion;
import com.incidentlearn.retraining.DatasetSnapshot;
import com.incidentlearn.training.ClassificationMetrics;
import com.incidentlearn.training.LogisticRegressionTrainer;
import com.incidentlearn.training.MetricEstimate;
import com.incidentlearn.training.ModelTrainer;
import com.incidentlearn.training.OfflineMetrics;
import com.incidentlearn.training.TrainingExample;
import com.incidentlearn.training.TrainingHyperparameters;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValidationGateTest {
    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private final MutableClock clock = MutableClock.startingAt("2026-01-02T00:00:00Z");
    private final LogisticRegressionTrainer trainer = new LogisticRegressionTrainer(256);
    private MetricsService metrics;
    private ModelRegistry registry;
    private ValidationReportStore reports;

    @BeforeEach
    void setUp() {
        metrics = new MetricsService(null, clock);
        registry = new ModelRegistry(tempDir.resolve("model-registry.json"), clock);
        reports = new ValidationReportStore(tempDir.resolve("validation-reports"));
    }

    @Test
    void shouldRejectOnInstabilityEvenWhenPerformancePasses() throws Exception {
        ModelVersion candidate = trainCandidate(0.82, 0.09);

        ValidationReport report = gate(List.of(new PerformanceCheck(), new StabilityCheck())).validate(candidate.id());

        assertFalse(report.passed());
        assertTrue(report.checks().get(0).passed());
        assertFalse(report.checks().get(1).passed());
        assertEquals(0.09, report.checks().get(1).evidence().get("crossFoldStddev"), 1e-9);
        assertTrue(report.rationale().startsWith("stability: Cross-fold accuracy stddev above threshold"), report.rationale());
        assertEquals(ModelStatus.REJECTED, registry.require(candidate.id()).status());
        assertEquals(1.0, metrics.total(MetricNames.VALIDATION_FAILED), 0.0);
    }

    @Test
    void shouldGateStableCandidate() throws Exception {
        ModelVersion candidate = trainCandidate(0.95, 0.01);

        ValidationReport report = gate(List.of(new PerformanceCheck(), new StabilityCheck())).validate(candidate.id());

        assertTrue(report.passed(), report.rationale());
        assertEquals(1.0, report.checks().get(1).evidence().get("holdoutAccuracy"), 1e-9);
        assertEquals(ModelStatus.GATED, registry.require(candidate.id()).status());
        assertThrows(IllegalStateException.class, () -> gate(List.of(new PerformanceCheck())).validate(candidate.id()));
    }

    @Test
    void shouldFailFastOnCorruptArtifact() throws Exception {
        ModelVersion candidate = trainCandidate(0.95, 0.01);
        Files.writeString(Path.of(candidate.artifactPath()), "{\"format\":\"logistic-hashing-v1\",\"dimension\":2,\"weights\":[1.0]}");
        CountingCheck counting = new CountingCheck();

        ValidationReport report = gate(List.of(counting)).validate(candidate.id());

        assertFalse(report.passed());
        assertEquals(1, report.checks().size());
        assertTrue(report.checks().get(0).fatal());
        assertEquals("artifact", report.checks().get(0).name());
        assertEquals(0, counting.runs.get());
        assertEquals(ModelStatus.REJECTED, registry.require(candidate.id()).status());
    }

    @Test
    void shouldTreatThrowingCheckAsFailure() throws Exception {
        ModelVersion candidate = trainCandidate(0.95, 0.01);
        ValidationCheck broken = new ValidationCheck() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public CheckResult run(ValidationContext context) {
                throw new IllegalStateException("no groups");
            }
        };

        ValidationReport report = gate(List.of(broken, new PerformanceCheck())).validate(candidate.id());

        assertFalse(report.passed());
        assertEquals(2, report.checks().size());
        assertTrue(report.rationale().contains("IllegalStateException"));
    }

    @Test
    void shouldReapplyStoredReportWithoutRerunningChecks() throws Exception {
        ModelVersion candidate = trainCandidate(0.95, 0.01);
        reports.save(new ValidationReport(candidate.id(), "default", List.of(CheckResult.pass("performance", Map.of(), "")), true,
                "All validation checks passed", clock.instant()));
        CountingCheck counting = new CountingCheck();

        ValidationReport report = gate(List.of(counting)).validate(candidate.id());

        assertTrue(report.passed());
        assertEquals(0, counting.runs.get());
        assertEquals(ModelStatus.GATED, registry.require(candidate.id()).status());
        assertThrows(IllegalStateException.class, () -> reports.save(report));
    }

    private ValidationGate gate(List<ValidationCheck> checks) {
        return new ValidationGate(trainer, registry, reports, metrics, ValidationPolicy.defaults(), checks, clock);
    }

    private ModelVersion trainCandidate(double accuracy, double stddev) throws Exception {
        List<TrainingExample> training = examples(0, 40);
        List<TrainingExample> holdout = examples(40, 20);
        List<TrainingExample> future = examples(60, 10);
        Path runDir = tempDir.resolve("models").resolve("run-" + registry.list().size());
        ModelTrainer.TrainingResult result = trainer.train(training, new TrainingHyperparameters(30, 0.5, 8, 0.0, 7L), runDir);
        Path datasetPath = runDir.resolve("dataset.json");
        new DatasetSnapshot(training, holdout, future).save(datasetPath);
        MetricEstimate estimate = new MetricEstimate(accuracy, stddev);
        OfflineMetrics offline = new OfflineMetrics(estimate, new MetricEstimate(0.80, 0.02), estimate, estimate, 5,
                ClassificationMetrics.evaluate(result.model(), holdout), training.size(), holdout.size(), future.size());
        return registry.registerCandidate("default", null, TimeWindow.trailing(START, Duration.ofDays(1)), TrainingHyperparameters.defaults(),
                offline, result.artifactPath().toString(), datasetPath.toString());
    }

    private static List<TrainingExample> examples(int from, int count) {
        List<TrainingExample> examples = new ArrayList<>();
        for (int i = from; i < from + count; i++) {
            boolean resolved = i % 2 == 0;
            String text = resolved ? "category database system db connection pool restart" : "category storage system nas disk quota cleanup";
            examples.add(new TrainingExample("INC-" + i, text, resolved ? "SOL-restart" : "SOL-cleanup", resolved, START.plusSeconds(i * 60L),
                    Map.of("source", i % 3 == 0 ? "user" : "operator", "category", resolved ? "database" : "storage")));
        }
        return examples;
    }

    private static final class CountingCheck implements ValidationCheck {
        private final AtomicInteger runs = new AtomicInteger();

        @Override
        public String name() {
            return "counting";
        }

        @Override
        public CheckResult run(ValidationContext context) {
            runs.incrementAndGet();
            return CheckResult.pass(name(), Map.of(), "");
        }
    }
}

package com.incidentlearn.validation;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.incidentlearn.metrics.MetricNames;
import com.incidentlearn.metrics.MetricsService;
import com.incidentlearn.model.ModelRegistry;
import com.incidentlearn.model.ModelStatus;
import com.incidentlearn.model.ModelVersion;
import com.incidentlearn.retraining.DatasetSnapshot;
import com.incidentlearn.training.CorruptArtifactException;
import com.incidentlearn.training.ModelTrainer;
import com.incidentlearn.training.TrainedModel;

/**
 * Runs every check against a candidate and moves it to {@code gated} or {@code rejected}. The report is written
 * before the registry changes, so a crash between the two is repaired by the next call with the stored report.
 */
public class ValidationGate {
    private static final Logger log = LoggerFactory.getLogger(ValidationGate.class);

    private final ModelTrainer trainer;
    private final ModelRegistry registry;
    private final ValidationReportStore reports;
    private final MetricsService metrics;
    private final ValidationPolicy policy;
    private final List<ValidationCheck> checks;
    private final Clock clock;

    public ValidationGate(
            ModelTrainer trainer,
            ModelRegistry registry,
            ValidationReportStore reports,
            MetricsService metrics,
            ValidationPolicy policy,
            Clock clock) {
        this(trainer, registry, reports, metrics, policy, defaultChecks(), clock);
    }

    public ValidationGate(
            ModelTrainer trainer,
            ModelRegistry registry,
            ValidationReportStore reports,
            MetricsService metrics,
            ValidationPolicy policy,
            List<ValidationCheck> checks,
            Clock clock) {
        this.trainer = Objects.requireNonNull(trainer, "trainer");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.reports = Objects.requireNonNull(reports, "reports");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.checks = List.copyOf(checks);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static List<ValidationCheck> defaultChecks() {
        return List.of(new PerformanceCheck(), new StabilityCheck(), new FairnessCheck(), new RobustnessCheck(), new DriftSensitivityCheck());
    }

    public ValidationPolicy policy() {
        return policy;
    }

    public Optional<ValidationReport> report(long modelVersionId) throws IOException {
        return reports.load(modelVersionId);
    }

    public ValidationReport validate(long modelVersionId) throws IOException {
        ModelVersion version = registry.require(modelVersionId);
        if (version.status() != ModelStatus.CANDIDATE) {
            throw new IllegalStateException("Model " + modelVersionId + " is " + version.status() + "; only candidates can be validated");
        }
        Optional<ValidationReport> existing = reports.load(modelVersionId);
        if (existing.isPresent()) {
            log.info("validation.resume model={} passed={}", modelVersionId, existing.get().passed());
            apply(existing.get());
            return existing.get();
        }

        List<CheckResult> results = runChecks(version);
        boolean passed = !results.isEmpty() && results.stream().allMatch(CheckResult::passed);
        String rationale = passed
                ? "All validation checks passed"
                : results.stream()
                        .filter(result -> !result.passed())
                        .map(result -> result.name() + ": " + result.rationale())
                        .collect(Collectors.joining("; "));
        ValidationReport report = new ValidationReport(modelVersionId, version.family(), results, passed, rationale, clock.instant());
        reports.save(report);
        apply(report);
        return report;
    }

    private List<CheckResult> runChecks(ModelVersion version) {
        TrainedModel model;
        DatasetSnapshot datasets;
        try {
            if (version.artifactPath() == null || version.datasetPath() == null) {
                return List.of(CheckResult.fatal("artifact", "Model has no artifact or dataset to validate"));
            }
            model = trainer.load(Path.of(version.artifactPath()));
            datasets = DatasetSnapshot.load(Path.of(version.datasetPath()));
        } catch (CorruptArtifactException e) {
            log.warn("validation.corrupt model={} reason={}", version.id(), e.getMessage());
            return List.of(CheckResult.fatal("artifact", "Artifact failed integrity check: " + e.getMessage()));
        } catch (IOException e) {
            log.warn("validation.unreadable model={} reason={}", version.id(), e.getMessage());
            return List.of(CheckResult.fatal("artifact", "Artifact or dataset unreadable: " + e.getMessage()));
        }

        ValidationContext context = new ValidationContext(version, model, datasets, policy);
        List<CheckResult> results = new ArrayList<>();
        for (ValidationCheck check : checks) {
            CheckResult result;
            try {
                result = check.run(context);
            } catch (RuntimeException e) {
                log.warn("validation.check_error model={} check={} error={}", version.id(), check.name(), e.toString());
                result = CheckResult.fail(check.name(), Map.of(), "Check raised " + e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            results.add(result);
            log.info("validation.check model={} check={} passed={}", version.id(), result.name(), result.passed());
            if (result.fatal()) {
                break;
            }
        }
        return results;
    }

    private void apply(ValidationReport report) throws IOException {
        if (report.passed()) {
            registry.transition(report.modelVersionId(), ModelStatus.GATED, report.rationale());
            metrics.increment(MetricNames.VALIDATION_PASSED, Map.of("family", report.family()));
        } else {
            registry.reject(report.modelVersionId(), report.rationale());
            metrics.increment(MetricNames.VALIDATION_FAILED, Map.of("family", report.family()));
            metrics.increment(MetricNames.MODELS_REJECTED, Map.of("family", report.family(), "stage", "validation"));
        }
        log.info("validation.done model={} passed={} rationale={}", report.modelVersionId(), report.passed(), report.rationale());
    }
}

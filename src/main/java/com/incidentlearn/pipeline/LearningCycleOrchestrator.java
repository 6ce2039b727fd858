package com.incidentlearn.pipeline;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.incidentlearn.corpus.IncidentCorpus;
import com.incidentlearn.corpus.IncidentObservation;
import com.incidentlearn.experiment.ABTest;
import com.incidentlearn.experiment.ExperimentService;
import com.incidentlearn.experiment.SafetyViolationException;
import com.incidentlearn.feedback.FeedbackAggregator;
import com.incidentlearn.feedback.FeedbackRecord;
import com.incidentlearn.feedback.TimeWindow;
import com.incidentlearn.metrics.AlertSeverity;
import com.incidentlearn.metrics.MetricNames;
import com.incidentlearn.metrics.MetricsService;
import com.incidentlearn.model.ConcurrencyConflictException;
import com.incidentlearn.model.IllegalTransitionException;
import com.incidentlearn.model.ModelRegistry;
import com.incidentlearn.model.ModelStatus;
import com.incidentlearn.model.ModelVersion;
import com.incidentlearn.model.ProductionPointer;
import com.incidentlearn.model.PromotionAuditEntry;
import com.incidentlearn.model.PromotionAuditLog;
import com.incidentlearn.patterns.AnalysisInput;
import com.incidentlearn.patterns.Pattern;
import com.incidentlearn.patterns.PatternAnalyzer;
import com.incidentlearn.retraining.InsufficientDataException;
import com.incidentlearn.retraining.RetrainingEngine;
import com.incidentlearn.retraining.RetrainingPlan;
import com.incidentlearn.retraining.RetrainingPlanner;
import com.incidentlearn.training.PipelineTimeoutException;
import com.incidentlearn.training.StageBudget;
import com.incidentlearn.validation.ValidationGate;
import com.incidentlearn.validation.ValidationReport;

/**
 * Runs learning cycles for one model family: feedback, patterns, candidates, validation, experiment, deployment.
 *
 * <p>State is persisted after every phase transition. A cycle interrupted by a crash, a pause, or a running
 * experiment is continued from its checkpoint by the next {@link #runCycle()} call. The production pointer is only
 * changed through the registry's compare-and-swap; a failed cycle never touches it.
 *
 * <p>Each cycle starts by scoring the serving model on feedback gathered since its deployment. A degraded model is
 * rolled back to the model it replaced, and the cycle retrains regardless of detected patterns.
 */
public class LearningCycleOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(LearningCycleOrchestrator.class);
    private static final String ACTOR = "orchestrator";

    private final String family;
    private final FeedbackAggregator feedback;
    private final IncidentCorpus corpus;
    private final PatternAnalyzer patternAnalyzer;
    private final RetrainingPlanner planner;
    private final RetrainingEngine retraining;
    private final ValidationGate validationGate;
    private final ExperimentService experiments;
    private final ModelRegistry registry;
    private final PromotionAuditLog auditLog;
    private final MetricsService metrics;
    private final CycleStateStore stateStore;
    private final CycleGovernor governor;
    private final DeploymentMonitor monitor;
    private final CycleSettings settings;
    private final ExecutorService validationExecutor;

    public LearningCycleOrchestrator(
            String family,
            FeedbackAggregator feedback,
            IncidentCorpus corpus,
            PatternAnalyzer patternAnalyzer,
            RetrainingPlanner planner,
            RetrainingEngine retraining,
            ValidationGate validationGate,
            ExperimentService experiments,
            ModelRegistry registry,
            PromotionAuditLog auditLog,
            MetricsService metrics,
            CycleStateStore stateStore,
            CycleGovernor governor,
            DeploymentMonitor monitor,
            CycleSettings settings,
            ExecutorService validationExecutor) {
        this.family = Objects.requireNonNull(family, "family");
        this.feedback = Objects.requireNonNull(feedback, "feedback");
        this.corpus = Objects.requireNonNull(corpus, "corpus");
        this.patternAnalyzer = Objects.requireNonNull(patternAnalyzer, "patternAnalyzer");
        this.planner = Objects.requireNonNull(planner, "planner");
        this.retraining = Objects.requireNonNull(retraining, "retraining");
        this.validationGate = Objects.requireNonNull(validationGate, "validationGate");
        this.experiments = Objects.requireNonNull(experiments, "experiments");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.auditLog = Objects.requireNonNull(auditLog, "auditLog");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.stateStore = Objects.requireNonNull(stateStore, "stateStore");
        this.governor = Objects.requireNonNull(governor, "governor");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.validationExecutor = Objects.requireNonNull(validationExecutor, "validationExecutor");
    }

    public String family() {
        return family;
    }

    public CycleState state() throws IOException {
        return stateStore.load(family);
    }

    public Optional<Long> currentProductionModel() throws IOException {
        return registry.currentProductionId(family);
    }

    /** Starts a new cycle, or continues the one in progress, and runs it as far as it can go. */
    public synchronized CycleReport runCycle() throws IOException, InterruptedException {
        CycleState state = stateStore.load(family);
        if (state.paused) {
            log.info("cycle.skipped family={} reason=paused", family);
            return new CycleReport(family, state.cycleId, state.phase, CycleOutcome.PAUSED, "Family paused by operator",
                    currentProductionModel().orElse(null));
        }
        if (state.inProgress()) {
            log.info("cycle.resume family={} cycle={} phase={}", family, state.cycleId, state.phase);
        } else {
            CycleGovernor.GovernorDecision decision = governor.evaluate(family);
            if (decision.halted()) {
                state.lastOutcome = CycleOutcome.HALTED;
                state.rationale = decision.reason() + " (incident " + decision.incidentId() + ")";
                persist(state);
                log.warn("cycle.halted family={} reason={} incident={}", family, decision.reason(), decision.incidentId());
                return CycleReport.of(state, currentProductionModel().orElse(null));
            }
            begin(state);
        }

        try {
            advance(state);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        } catch (Exception e) {
            fail(state, e);
        }
        return CycleReport.of(state, currentProductionModel().orElse(null));
    }

    public void pauseCycle() throws IOException {
        CycleState state = stateStore.load(family);
        state.paused = true;
        state.updatedAt = Instant.now(metrics.clock());
        stateStore.save(state);
        log.info("cycle.paused family={} cycle={} phase={}", family, state.cycleId, state.phase);
    }

    /** Lifts a pause and clears the governor's failure streak. */
    public void resumeCycle() throws IOException {
        CycleState state = stateStore.load(family);
        state.paused = false;
        state.updatedAt = Instant.now(metrics.clock());
        stateStore.save(state);
        governor.reset(family);
        log.info("cycle.resumed family={} cycle={} phase={}", family, state.cycleId, state.phase);
    }

    public ABTest abortTest(String testId, String reason) throws IOException {
        ABTest test = experiments.find(testId).orElseThrow(() -> new IllegalArgumentException("Unknown A/B test " + testId));
        if (!family.equals(test.family())) {
            throw new IllegalArgumentException("A/B test " + testId + " belongs to family " + test.family());
        }
        return experiments.abort(testId, reason == null || reason.isBlank() ? "Aborted by operator" : "Aborted by operator: " + reason);
    }

    /**
     * Promotes a model that passed validation without an experiment. Tests whose control is the replaced model are
     * aborted since their comparison no longer applies.
     */
    public ProductionPointer forcePromote(long modelId, String reason, String actor) throws IOException {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("force-promote requires an audit reason");
        }
        ModelVersion version = registry.require(modelId);
        if (!family.equals(version.family())) {
            throw new IllegalArgumentException("Model " + modelId + " belongs to family " + version.family());
        }
        if (version.status() != ModelStatus.GATED && version.status() != ModelStatus.EXPERIMENTING) {
            throw new IllegalStateException("Model " + modelId + " is " + version.status() + "; only models that passed validation can be promoted");
        }
        List<ABTest> active = experiments.active(family);
        Optional<ABTest> underTest = active.stream().filter(test -> test.treatmentModelId() == modelId).findFirst();
        if (underTest.isPresent()) {
            throw new IllegalStateException("Model " + modelId + " is the treatment of running A/B test " + underTest.get().id());
        }
        if (version.status() == ModelStatus.GATED) {
            registry.transition(modelId, ModelStatus.EXPERIMENTING, "Forced promotion requested by " + actor);
        }
        Long previous = registry.currentProductionId(family).orElse(null);
        ProductionPointer pointer = registry.promote(family, previous, modelId, "Forced by " + actor + ": " + reason);
        auditLog.append(new PromotionAuditEntry(pointer.updatedAt(), family, actor, reason, PromotionAuditEntry.Kind.FORCED, previous, modelId,
                null, pointer.version()));
        metrics.increment(MetricNames.MODELS_PROMOTED, Map.of("family", family, "kind", "forced"));
        log.warn("cycle.force_promote family={} model={} previous={} actor={} reason={}", family, modelId, previous, actor, reason);

        for (ABTest test : active) {
            if (previous != null && test.controlModelId() == previous) {
                experiments.abort(test.id(), "Control model " + previous + " retired by forced promotion of " + modelId);
            }
        }
        return pointer;
    }

    private void begin(CycleState state) throws IOException {
        Instant now = metrics.clock().instant();
        state.cycleId++;
        state.totalCycles++;
        state.phase = CyclePhase.AGGREGATING;
        state.startedAt = now;
        state.completedAt = null;
        state.checkpoint = new CycleState.Checkpoint();
        state.lastOutcome = null;
        state.rationale = null;
        state.lastError = null;
        persist(state);
        log.info("cycle.started family={} cycle={} windowMultiplier={}", family, state.cycleId, state.windowMultiplier);
    }

    private void advance(CycleState state) throws Exception {
        while (state.inProgress()) {
            if (stateStore.load(family).paused) {
                state.lastOutcome = CycleOutcome.PAUSED;
                state.rationale = "Paused by operator before " + state.phase;
                persist(state);
                log.info("cycle.paused_at family={} cycle={} phase={}", family, state.cycleId, state.phase);
                return;
            }
            CyclePhase current = state.phase;
            CyclePhase next = switch (current) {
                case AGGREGATING -> aggregate(state);
                case ANALYZING -> analyze(state);
                case RETRAINING -> retrain(state);
                case VALIDATING -> validate(state);
                case EXPERIMENTING -> experiment(state);
                case DEPLOYING -> deploy(state);
                case COMPLETED, FAILED -> throw new IllegalStateException("cycle already finished");
            };
            if (next == null) {
                persist(state);
                return;
            }
            state.phase = next;
            log.info("cycle.phase.completed family={} cycle={} phase={} next={}", family, state.cycleId, current, next);
            if (next == CyclePhase.COMPLETED) {
                completed(state);
            }
            persist(state);
        }
    }

    private CyclePhase aggregate(CycleState state) throws Exception {
        checkDeployment(state);
        Instant now = metrics.clock().instant();
        TimeWindow window = TimeWindow.trailing(now, settings.trainingWindow().multipliedBy(state.windowMultiplier));
        int archived = runWithRetries(() -> feedback.archiveExpired(settings.feedbackRetention()));
        state.checkpoint.windowStart = window.start();
        state.checkpoint.windowEnd = window.end();
        state.checkpoint.feedbackCount = retraining.scope(feedback.window(window)).size();
        log.info("cycle.aggregated family={} cycle={} feedback={} archived={}", family, state.cycleId, state.checkpoint.feedbackCount, archived);
        return CyclePhase.ANALYZING;
    }

    private void checkDeployment(CycleState state) throws IOException {
        Optional<DeploymentMonitor.HealthReport> checked = monitor.check();
        if (checked.isEmpty() || !checked.get().degraded()) {
            return;
        }
        DeploymentMonitor.HealthReport report = checked.get();
        long degradedId = report.modelId();
        double floor = monitor.policy().minLiveAccuracy();
        AlertSeverity severity = Double.isNaN(report.liveAccuracy()) || report.liveAccuracy() < floor * 0.8
                ? AlertSeverity.CRITICAL
                : AlertSeverity.HIGH;
        metrics.raiseAlert("deployment.degraded", severity, "Model " + degradedId + " degraded: " + report.reason(),
                Map.of("family", family, "model", String.valueOf(degradedId)));
        state.checkpoint.degradedModelId = degradedId;
        state.checkpoint.forceRetrainReason = "Production model " + degradedId + " degraded: " + report.reason();

        ProductionPointer pointer = registry.productionPointer(family);
        Long previous = pointer.previousModelId();
        if (!Objects.equals(pointer.modelId(), degradedId) || previous == null
                || registry.require(previous).status() != ModelStatus.RETIRED) {
            log.warn("cycle.rollback.unavailable family={} model={} previous={}", family, degradedId, previous);
            return;
        }
        ProductionPointer restored;
        try {
            restored = registry.rollback(family, degradedId, report.reason());
        } catch (ConcurrencyConflictException e) {
            log.warn("cycle.rollback.conflict family={} expected={} actual={}", family, degradedId, e.actualModelId());
            return;
        }
        auditLog.append(new PromotionAuditEntry(restored.updatedAt(), family, ACTOR, report.reason(), PromotionAuditEntry.Kind.ROLLBACK,
                degradedId, restored.modelId(), null, restored.version()));
        metrics.increment(MetricNames.MODELS_ROLLED_BACK, Map.of("family", family));
        for (ABTest test : experiments.active(family)) {
            if (test.controlModelId() == degradedId) {
                experiments.abort(test.id(), "Control model " + degradedId + " rolled back to " + restored.modelId());
            }
        }
        log.warn("cycle.rollback family={} cycle={} from={} to={} reason={}", family, state.cycleId, degradedId, restored.modelId(), report.reason());
    }

    private CyclePhase analyze(CycleState state) throws Exception {
        Instant end = state.checkpoint.windowEnd;
        TimeWindow analysisWindow = TimeWindow.trailing(end, settings.analysisWindow());
        TimeWindow recentWindow = TimeWindow.trailing(end, settings.recentWindow());
        List<FeedbackRecord> records = retraining.scope(feedback.window(analysisWindow, true));
        List<IncidentObservation> incidents = corpus.between(analysisWindow).stream().filter(retraining::covers).toList();
        AnalysisInput input = new AnalysisInput(analysisWindow, recentWindow, records, incidents, patternAnalyzer.baselines(), end);
        List<Pattern> patterns = runWithRetries(() -> patternAnalyzer.analyze(input));
        state.checkpoint.patternIds = patterns.stream().map(Pattern::id).collect(Collectors.toCollection(ArrayList::new));

        RetrainingPlan plan = state.checkpoint.forceRetrainReason != null
                ? planner.forced(state.checkpoint.forceRetrainReason)
                : planner.plan(patterns, state.checkpoint.feedbackCount, registry.currentProductionId(family).isPresent());
        state.checkpoint.planReason = plan.reason();
        if (!plan.retrain()) {
            return finish(state, CycleOutcome.SKIPPED, plan.reason());
        }
        state.checkpoint.candidateConfigurations = new ArrayList<>(plan.candidates());
        log.info("cycle.plan family={} cycle={} candidates={} reason={}", family, state.cycleId, plan.candidates().size(), plan.reason());
        return CyclePhase.RETRAINING;
    }

    private CyclePhase retrain(CycleState state) throws IOException, InterruptedException {
        TimeWindow window = new TimeWindow(state.checkpoint.windowStart, state.checkpoint.windowEnd);
        Long base = registry.currentProductionId(family).orElse(null);
        List<ModelVersion> versions;
        try {
            versions = retraining.retrainCandidates(window, base, state.checkpoint.candidateConfigurations);
        } catch (InsufficientDataException e) {
            state.windowMultiplier = Math.min(state.windowMultiplier * 2, settings.maxWindowMultiplier());
            return finish(state, CycleOutcome.INSUFFICIENT_DATA,
                    e.getMessage() + "; next cycle uses " + state.windowMultiplier + "x the training window");
        }
        state.windowMultiplier = 1;
        state.checkpoint.candidateIds = versions.stream()
                .filter(RetrainingEngine::isCandidate)
                .map(ModelVersion::id)
                .collect(Collectors.toCollection(ArrayList::new));
        if (state.checkpoint.candidateIds.isEmpty()) {
            String reasons = versions.stream().map(ModelVersion::rationale).collect(Collectors.joining("; "));
            return finish(state, CycleOutcome.NOT_PROMOTED, "No candidate survived retraining: " + reasons);
        }
        return CyclePhase.VALIDATING;
    }

    private CyclePhase validate(CycleState state) throws IOException, InterruptedException {
        Map<Long, Future<ValidationReport>> futures = new LinkedHashMap<>();
        Map<Long, StageBudget> budgets = new LinkedHashMap<>();
        for (Long id : state.checkpoint.candidateIds) {
            if (registry.require(id).status() == ModelStatus.CANDIDATE) {
                budgets.put(id, StageBudget.startingNow("validation", settings.validationTimeout()));
                futures.put(id, validationExecutor.submit(() -> validationGate.validate(id)));
            }
        }
        for (Map.Entry<Long, Future<ValidationReport>> entry : futures.entrySet()) {
            long id = entry.getKey();
            try {
                ValidationReport report = budgets.get(id).await(entry.getValue());
                log.info("cycle.validated family={} model={} passed={}", family, id, report.passed());
            } catch (PipelineTimeoutException e) {
                log.warn("cycle.validation.timeout family={} model={} budget={}", family, id, settings.validationTimeout());
                rejectIfOpen(id, e.getMessage());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.warn("cycle.validation.failed family={} model={} reason={}", family, id, cause.getMessage(), cause);
                rejectIfOpen(id, "Validation failed: " + cause.getMessage());
            }
        }

        List<ModelVersion> gated = new ArrayList<>();
        for (Long id : state.checkpoint.candidateIds) {
            ModelVersion version = registry.require(id);
            if (version.status() == ModelStatus.GATED || version.status() == ModelStatus.EXPERIMENTING) {
                gated.add(version);
            }
        }
        if (gated.isEmpty()) {
            return finish(state, CycleOutcome.NOT_PROMOTED, "No candidate passed validation");
        }
        ModelVersion best = gated.stream()
                .max(Comparator.comparingDouble((ModelVersion version) -> primaryScore(version)).thenComparingLong(ModelVersion::id))
                .orElseThrow();
        state.checkpoint.selectedModelId = best.id();
        return CyclePhase.EXPERIMENTING;
    }

    private CyclePhase experiment(CycleState state) throws IOException {
        long treatmentId = state.checkpoint.selectedModelId;
        if (state.checkpoint.testId == null) {
            Optional<Long> production = registry.currentProductionId(family);
            if (production.isEmpty()) {
                if (registry.require(treatmentId).status() == ModelStatus.GATED) {
                    registry.transition(treatmentId, ModelStatus.EXPERIMENTING, "Bootstrap deployment: family has no production model");
                }
                state.checkpoint.bootstrap = true;
                return CyclePhase.DEPLOYING;
            }
            Duration horizon = experiments.policy().horizon();
            if (state.checkpoint.experimentAttempt > 1) {
                horizon = Duration.ofMillis((long) (horizon.toMillis() * experiments.policy().retryHorizonMultiplier()));
            }
            ABTest test = experiments.create(family, production.get(), treatmentId, experiments.policy().defaultTrafficSplit(), horizon,
                    state.checkpoint.experimentAttempt);
            state.checkpoint.testId = test.id();
            persist(state);
            experiments.start(test.id());
        }

        ABTest test;
        try {
            test = experiments.evaluate(state.checkpoint.testId);
        } catch (SafetyViolationException e) {
            state.checkpoint.safetyAbort = true;
            return finish(state, CycleOutcome.NOT_PROMOTED, e.getMessage());
        }
        return switch (test.state()) {
            case DRAFT -> {
                experiments.start(test.id());
                yield waiting(state, test);
            }
            case RUNNING, ANALYZING -> waiting(state, test);
            case ABORTED -> finish(state, CycleOutcome.NOT_PROMOTED, "A/B test " + test.id() + " aborted: " + test.rationale());
            case CONCLUDED -> decided(state, test);
        };
    }

    private CyclePhase waiting(CycleState state, ABTest test) {
        state.lastOutcome = CycleOutcome.WAITING_FOR_EXPERIMENT;
        state.rationale = "A/B test " + test.id() + " running until " + test.endsAt();
        return null;
    }

    private CyclePhase decided(CycleState state, ABTest test) throws IOException {
        long treatmentId = test.treatmentModelId();
        ModelVersion treatment = registry.require(treatmentId);
        return switch (test.decision()) {
            case ADOPT -> CyclePhase.DEPLOYING;
            case REJECT -> {
                rejectIfOpen(treatmentId, "A/B test " + test.id() + " rejected the model: " + test.rationale());
                yield finish(state, CycleOutcome.NOT_PROMOTED, test.rationale());
            }
            case INCONCLUSIVE -> {
                if (treatment.status() == ModelStatus.EXPERIMENTING) {
                    registry.transition(treatmentId, ModelStatus.CANDIDATE, "Inconclusive A/B test " + test.id() + ": " + test.rationale());
                }
                if (state.checkpoint.experimentAttempt < settings.maxExperimentAttempts()) {
                    state.checkpoint.experimentAttempt++;
                    state.checkpoint.testId = null;
                    state.checkpoint.candidateIds = new ArrayList<>(List.of(treatmentId));
                    log.info("cycle.experiment.retry family={} model={} attempt={}", family, treatmentId, state.checkpoint.experimentAttempt);
                    yield CyclePhase.VALIDATING;
                }
                rejectIfOpen(treatmentId, "Inconclusive after " + state.checkpoint.experimentAttempt + " A/B tests");
                yield finish(state, CycleOutcome.NOT_PROMOTED, "Inconclusive after " + state.checkpoint.experimentAttempt + " A/B tests");
            }
        };
    }

    private CyclePhase deploy(CycleState state) throws IOException {
        long treatmentId = state.checkpoint.selectedModelId;
        if (registry.require(treatmentId).status() == ModelStatus.PRODUCTION) {
            return finish(state, CycleOutcome.PROMOTED, "Model " + treatmentId + " already serving");
        }
        Long expected = state.checkpoint.bootstrap
                ? null
                : experiments.find(state.checkpoint.testId).map(ABTest::controlModelId).orElse(null);
        PromotionAuditEntry.Kind kind = state.checkpoint.bootstrap ? PromotionAuditEntry.Kind.BOOTSTRAP : PromotionAuditEntry.Kind.EXPERIMENT_ADOPTED;
        String reason = state.checkpoint.bootstrap
                ? "Bootstrap deployment of model " + treatmentId
                : "A/B test " + state.checkpoint.testId + " adopted model " + treatmentId;

        ProductionPointer pointer;
        try {
            pointer = registry.promote(family, expected, treatmentId, reason);
        } catch (ConcurrencyConflictException e) {
            Long actual = e.actualModelId();
            if (actual != null && actual > treatmentId) {
                rejectIfOpen(treatmentId, "Superseded by production model " + actual + " during deployment");
                return finish(state, CycleOutcome.NOT_PROMOTED, e.getMessage());
            }
            log.warn("cycle.deploy.conflict family={} expected={} actual={} model={} action=retry", family, expected, actual, treatmentId);
            expected = actual;
            pointer = registry.promote(family, expected, treatmentId, reason + " (retried after concurrent pointer change)");
        }
        auditLog.append(new PromotionAuditEntry(pointer.updatedAt(), family, ACTOR, reason, kind, expected, treatmentId,
                state.checkpoint.testId, pointer.version()));
        metrics.increment(MetricNames.MODELS_PROMOTED, Map.of("family", family, "kind", kind.name().toLowerCase(Locale.ROOT)));
        return finish(state, CycleOutcome.PROMOTED, reason);
    }

    private CyclePhase finish(CycleState state, CycleOutcome outcome, String rationale) {
        state.lastOutcome = outcome;
        state.rationale = rationale;
        return CyclePhase.COMPLETED;
    }

    private void completed(CycleState state) throws IOException {
        Instant now = metrics.clock().instant();
        state.completedAt = now;
        state.completedCycles++;
        boolean safetyAbort = state.checkpoint.safetyAbort;
        governor.recordOutcome(family, !safetyAbort, safetyAbort);
        metrics.increment(MetricNames.CYCLES_COMPLETED, Map.of("family", family, "outcome", state.lastOutcome.name().toLowerCase(Locale.ROOT)));
        if (state.startedAt != null) {
            metrics.recordDuration(MetricNames.CYCLE_DURATION, Duration.between(state.startedAt, now), Map.of("family", family));
        }
        log.info("cycle.completed family={} cycle={} outcome={} rationale={}", family, state.cycleId, state.lastOutcome, state.rationale);
    }

    private void fail(CycleState state, Exception e) throws IOException {
        CyclePhase failedIn = state.phase;
        state.phase = CyclePhase.FAILED;
        state.failedCycles++;
        state.completedAt = metrics.clock().instant();
        state.lastOutcome = CycleOutcome.FAILED;
        state.lastError = e.getMessage();
        state.rationale = "Cycle failed during " + failedIn + ": " + e.getMessage();
        persist(state);
        governor.recordOutcome(family, false, false);
        metrics.increment(MetricNames.CYCLES_FAILED, Map.of("family", family, "phase", String.valueOf(failedIn)));
        log.error("cycle.failed family={} cycle={} phase={} reason={}", family, state.cycleId, failedIn, e.getMessage(), e);
    }

    private void rejectIfOpen(long modelId, String rationale) throws IOException {
        ModelVersion version = registry.require(modelId);
        if (!version.status().canTransitionTo(ModelStatus.REJECTED)) {
            return;
        }
        try {
            registry.reject(modelId, rationale);
        } catch (IllegalTransitionException e) {
            log.warn("cycle.reject.skipped model={} reason={}", modelId, e.getMessage());
        }
    }

    private double primaryScore(ModelVersion version) {
        if (version.offlineMetrics() == null) {
            return Double.NEGATIVE_INFINITY;
        }
        return version.offlineMetrics().estimate(validationGate.policy().primaryMetric()).mean();
    }

    private void persist(CycleState state) throws IOException {
        state.paused = stateStore.load(family).paused;
        state.updatedAt = metrics.clock().instant();
        stateStore.save(state);
    }

    private <T> T runWithRetries(ThrowingSupplier<T> supplier) throws Exception {
        Exception last = null;
        int maxAttempts = Math.max(1, settings.maxRetries() + 1);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return supplier.get();
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                long backoff = settings.retryBackoffMs() * attempt;
                log.warn("cycle.retry family={} attempt={} maxAttempts={} backoffMs={} reason={}", family, attempt, maxAttempts, backoff, e.getMessage());
                Thread.sleep(backoff);
            }
        }
        throw last;
    }

    @FunctionalInterface
    private interface ThrowingSupplier<T> {
        T get() throws Exception;
    }
}

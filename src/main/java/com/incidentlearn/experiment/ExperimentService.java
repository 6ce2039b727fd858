package com.incidentlearn.experiment;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.incidentlearn.metrics.AlertSeverity;
import com.incidentlearn.metrics.MetricNames;
import com.incidentlearn.metrics.MetricsService;
import com.incidentlearn.model.ModelRegistry;
import com.incidentlearn.model.ModelStatus;
import com.incidentlearn.model.ModelVersion;
import com.incidentlearn.stats.MultipleComparisons;
import com.incidentlearn.stats.PowerAnalysis;

/**
 * Lifecycle of A/B tests: {@code draft -> running -> analyzing -> concluded}, with {@code aborted} reachable from
 * any non-terminal state. Test records are re-read from disk on every call so an operator abort issued from another
 * process takes effect on the next sample.
 */
public class ExperimentService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExperimentService.class);

    private final ExperimentStore store;
    private final ModelRegistry registry;
    private final MetricsService metrics;
    private final ExperimentPolicy policy;
    private final ExperimentAnalyzer analyzer = new ExperimentAnalyzer();
    private final Clock clock;
    private final List<Consumer<ABTest>> completionListeners = new CopyOnWriteArrayList<>();
    private ScheduledExecutorService scheduler;

    public ExperimentService(ExperimentStore store, ModelRegistry registry, MetricsService metrics, ExperimentPolicy policy, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ExperimentPolicy policy() {
        return policy;
    }

    /** Called once a test reaches {@code concluded} or {@code aborted}. */
    public void addCompletionListener(Consumer<ABTest> listener) {
        completionListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public synchronized ABTest create(String family, long controlModelId, long treatmentModelId, double trafficSplit, Duration horizon,
            int attempt) throws IOException {
        if (trafficSplit <= 0.0 || trafficSplit > policy.maxTrafficSplit()) {
            throw new IllegalArgumentException("traffic split must be in (0, " + policy.maxTrafficSplit() + "]: " + trafficSplit);
        }
        Long production = registry.currentProductionId(family).orElse(null);
        if (production == null || production != controlModelId) {
            throw new IllegalArgumentException("Control " + controlModelId + " is not the production model of " + family
                    + " (current=" + production + ")");
        }
        ModelVersion treatment = registry.require(treatmentModelId);
        if (!family.equals(treatment.family()) || treatment.status() != ModelStatus.GATED) {
            throw new IllegalArgumentException("Treatment " + treatmentModelId + " must be a gated model of " + family
                    + " (status=" + treatment.status() + ")");
        }
        double primaryAlpha = MultipleComparisons.bonferroni(policy.significanceLevel(), Math.max(1, policy.primaryMetrics().size()));
        long planned = Math.max(policy.minSamplesPerVariant(),
                PowerAnalysis.requiredSamplesPerVariant(primaryAlpha, policy.power(), policy.minDetectableEffect()));
        ABTest test = store.insert(tests -> {
            List<ABTest> active = tests.values().stream()
                    .filter(existing -> family.equals(existing.family()) && existing.state().active())
                    .toList();
            if (active.size() >= policy.maxConcurrentTests()) {
                throw new IllegalStateException("Family " + family + " already has " + active.size() + " active tests");
            }
            if (active.stream().anyMatch(existing -> existing.treatmentModelId() == treatmentModelId)) {
                throw new IllegalStateException("Model " + treatmentModelId + " is already under test");
            }
            double allocated = active.stream().mapToDouble(ABTest::trafficSplit).sum();
            if (allocated + trafficSplit > 1.0 + 1e-9) {
                throw new IllegalStateException(String.format(Locale.ROOT,
                        "Traffic conflict in %s: active tests hold %.0f%% of traffic, %.0f%% more would exceed 100%%",
                        family, allocated * 100, trafficSplit * 100));
            }
            String id = String.format("ab-%s-%04d", family, tests.size() + 1);
            return new ABTest(id, family, controlModelId, treatmentModelId, trafficSplit, policy.primaryMetrics(), policy.guardRails(),
                    policy.significanceLevel(), planned, attempt, ABTestState.DRAFT, clock.instant(), null,
                    clock.instant().plus(horizon), null, null, null);
        });
        log.info("abtest.created id={} family={} control={} treatment={} split={} plannedPerVariant={}",
                test.id(), family, controlModelId, treatmentModelId, trafficSplit, planned);
        return test;
    }

    /** Starts a draft test; the horizon set at creation is measured from now. */
    public synchronized ABTest start(String testId) throws IOException {
        ABTest test = require(testId);
        Duration horizon = Duration.between(test.createdAt(), test.endsAt());
        ModelVersion treatment = registry.require(test.treatmentModelId());
        if (treatment.status() == ModelStatus.GATED) {
            registry.transition(treatment.id(), ModelStatus.EXPERIMENTING, "A/B test " + testId + " started");
        }
        registry.recordExperimentAttempt(treatment.id());
        Instant now = clock.instant();
        ABTest running = test.started(now, now.plus(horizon));
        store.save(running);
        publishActive();
        log.info("abtest.started id={} endsAt={}", testId, running.endsAt());
        return running;
    }

    public Variant assign(String testId, String subjectId) throws IOException {
        return TrafficAssigner.assign(require(testId), subjectId);
    }

    /** Stores a live outcome. Returns false, storing nothing, unless the test is running. */
    public synchronized boolean recordSample(MetricSample sample) throws IOException {
        Optional<ABTest> test = store.find(sample.testId());
        if (test.isEmpty() || test.get().state() != ABTestState.RUNNING) {
            log.debug("abtest.sample.refused test={} state={}", sample.testId(), test.map(ABTest::state).orElse(null));
            return false;
        }
        store.appendSample(sample);
        metrics.increment(MetricNames.ABTESTS_SAMPLES, Map.of("test", sample.testId(), "variant", sample.variant().name().toLowerCase(Locale.ROOT)));
        return true;
    }

    /**
     * One evaluation pass. Past {@code endsAt} the test is analyzed and concluded; before it, early stopping may
     * conclude it. Passes over a test that is no longer running return it unchanged.
     *
     * @throws SafetyViolationException after aborting the test, when a primary metric is harmed beyond the limit or a
     *         guard rail is significantly worse
     */
    public synchronized ABTest evaluate(String testId) throws IOException {
        ABTest test = require(testId);
        if (test.state() == ABTestState.ANALYZING) {
            return conclude(test, analyze(testId));
        }
        if (test.state() != ABTestState.RUNNING) {
            return test;
        }
        List<MetricSample> samples = store.samples(testId);
        if (!clock.instant().isBefore(test.endsAt())) {
            ABTest analyzing = test.withState(ABTestState.ANALYZING);
            store.save(analyzing);
            log.info("abtest.horizon_reached id={}", testId);
            ExperimentAnalysis analysis = analyzer.analyze(analyzing, samples);
            Optional<MetricAnalysis> breached = ExperimentAnalyzer.breachedGuardRail(analysis);
            if (breached.isPresent()) {
                throw safetyAbort(analyzing, breached.get());
            }
            return conclude(analyzing, analysis);
        }
        ExperimentAnalyzer.EarlyStopAssessment assessment =
                analyzer.assessEarlyStop(test, samples, policy.minSamplesPerVariant(), policy.maxNegativeImpact());
        if (assessment.safetyViolation().isPresent()) {
            throw safetyAbort(test, assessment.safetyViolation().get());
        }
        if (assessment.stop()) {
            ABTest analyzing = test.withState(ABTestState.ANALYZING);
            store.save(analyzing);
            log.info("abtest.early_stop id={} decision={}", testId, assessment.analysis().decision());
            return conclude(analyzing, assessment.analysis());
        }
        return test;
    }

    private SafetyViolationException safetyAbort(ABTest test, MetricAnalysis harmed) throws IOException {
        SafetyViolationException violation = new SafetyViolationException(test.id(), harmed.metricName(), harmed.directionalImprovement());
        abort(test.id(), violation.getMessage());
        metrics.raiseAlert("abtest.safety_violation", AlertSeverity.CRITICAL, violation.getMessage(),
                Map.of("test", test.id(), "family", test.family(), "metric", harmed.metricName()));
        return violation;
    }

    /** Evaluates every active test, isolating failures per test. */
    public List<ABTest> evaluateAll() throws IOException {
        List<ABTest> evaluated = new ArrayList<>();
        for (ABTest test : store.loadTests().values()) {
            if (test.state() != ABTestState.RUNNING && test.state() != ABTestState.ANALYZING) {
                continue;
            }
            try {
                evaluated.add(evaluate(test.id()));
            } catch (SafetyViolationException e) {
                log.warn("abtest.safety_violation id={} reason={}", test.id(), e.getMessage());
                evaluated.add(require(test.id()));
            }
        }
        return evaluated;
    }

    /** Re-runs the analysis over every stored sample without changing state. */
    public ExperimentAnalysis analyze(String testId) throws IOException {
        ABTest test = require(testId);
        return analyzer.analyze(test, store.samples(testId));
    }

    /** Stops treatment traffic immediately and records a reject decision. */
    public synchronized ABTest abort(String testId, String reason) throws IOException {
        ABTest test = require(testId);
        if (test.state().terminal()) {
            throw new IllegalStateException("A/B test " + testId + " is already " + test.state());
        }
        String rationale = reason == null || reason.isBlank() ? "Aborted by operator" : reason;
        ABTest aborted = test.finished(ABTestState.ABORTED, Decision.REJECT, rationale, clock.instant());
        store.save(aborted);
        ModelVersion treatment = registry.require(test.treatmentModelId());
        if (treatment.status() == ModelStatus.EXPERIMENTING || treatment.status() == ModelStatus.GATED) {
            registry.reject(treatment.id(), "A/B test " + testId + " aborted: " + rationale);
        }
        metrics.increment(MetricNames.ABTESTS_ABORTED, Map.of("family", test.family()));
        publishActive();
        log.warn("abtest.aborted id={} reason={}", testId, rationale);
        notifyCompletion(aborted);
        return aborted;
    }

    public Optional<ABTest> find(String testId) throws IOException {
        return store.find(testId);
    }

    public List<ABTest> list() throws IOException {
        return List.copyOf(store.loadTests().values());
    }

    public List<ABTest> active(String family) throws IOException {
        return store.loadTests().values().stream()
                .filter(test -> family.equals(test.family()) && test.state().active())
                .toList();
    }

    /** Enforces {@code endsAt} and early stopping on a fixed interval. */
    public synchronized void startScheduler(Duration interval) {
        if (scheduler != null) {
            return;
        }
        long intervalMs = Math.max(1L, interval.toMillis());
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "abtest-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleAtFixedRate(this::evaluateAllSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("abtest.scheduler.started intervalMs={}", intervalMs);
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    private void evaluateAllSafely() {
        try {
            evaluateAll();
        } catch (IOException | RuntimeException e) {
            log.error("abtest.evaluation.failed reason={}", e.getMessage(), e);
        }
    }

    private ABTest conclude(ABTest analyzing, ExperimentAnalysis analysis) throws IOException {
        ABTest concluded = analyzing.finished(ABTestState.CONCLUDED, analysis.decision(), analysis.rationale(), clock.instant());
        store.save(concluded);
        metrics.increment(MetricNames.ABTESTS_COMPLETED, Map.of("family", concluded.family(), "decision", analysis.decision().name().toLowerCase(Locale.ROOT)));
        publishActive();
        log.info("abtest.concluded id={} decision={} rationale={}", concluded.id(), concluded.decision(), concluded.rationale());
        notifyCompletion(concluded);
        return concluded;
    }

    private void notifyCompletion(ABTest test) {
        for (Consumer<ABTest> listener : completionListeners) {
            try {
                listener.accept(test);
            } catch (RuntimeException e) {
                log.warn("abtest.listener.failed id={} reason={}", test.id(), e.getMessage());
            }
        }
    }

    private void publishActive() throws IOException {
        long running = store.loadTests().values().stream().filter(test -> test.state() == ABTestState.RUNNING).count();
        metrics.gauge(MetricNames.ABTESTS_ACTIVE, running);
    }

    private ABTest require(String testId) throws IOException {
        return store.find(testId).orElseThrow(() -> new IllegalArgumentException("Unknown A/B test " + testId));
    }
}

package com.incidentlearn.pipeline;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.incidentlearn.LearningFixtures;
import com.incidentlearn.MutableClock;
import com.incidentlearn.experiment.ABTest;
import com.incidentlearn.experiment.ABTestState;
import com.incidentlearn.experiment.ExperimentPolicy;
import com.incidentlearn.experiment.MetricSample;
import com.incidentlearn.experiment.Variant;
import com.incidentlearn.feedback.TimeWindow;
import com.incidentlearn.metrics.AlertSeverity;
import com.incidentlearn.metrics.MetricNames;
import com.incidentlearn.model.ModelStatus;
import com.incidentlearn.model.ModelVersion;
import com.incidentlearn.model.PromotionAuditEntry;
import com.incidentlearn.patterns.Baseline;
import com.incidentlearn.patterns.BaselineStore;
import com.incidentlearn.runtime.AppConfig;
import com.incidentlearn.runtime.LearningPipeline;
import com.incidentlearn.training.TrainingHyperparameters;

import okhttp3.OkHttpClient;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LearningCycleOrchestratorTest {
    @TempDir
    Path tempDir;

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T00:00:00Z");
    private LearningPipeline pipeline;
    private LearningCycleOrchestrator orchestrator;

    @BeforeEach
    void setUp() throws Exception {
        pipeline = new LearningPipeline(config(tempDir), clock, new OkHttpClient());
        orchestrator = pipeline.orchestrator("default");
    }

    @AfterEach
    void tearDown() {
        pipeline.close();
    }

    @Test
    void shouldBootstrapFirstModelWithoutExperiment() throws Exception {
        seed(60);

        CycleReport report = orchestrator.runCycle();

        assertEquals(CycleOutcome.PROMOTED, report.outcome(), report.rationale());
        assertEquals(CyclePhase.COMPLETED, report.phase());
        long production = report.productionModelId();
        assertEquals(ModelStatus.PRODUCTION, pipeline.registry().require(production).status());
        List<PromotionAuditEntry> audit = pipeline.auditLog().readAll();
        assertEquals(1, audit.size());
        assertEquals(PromotionAuditEntry.Kind.BOOTSTRAP, audit.get(0).kind());
        assertEquals(1, orchestrator.state().completedCycles);
        assertTrue(pipeline.experiments().list().isEmpty());
    }

    @Test
    void shouldAdoptTreatmentAfterExperimentHorizon() throws Exception {
        seed(60);
        long control = orchestrator.runCycle().productionModelId();

        CycleReport waiting = orchestrator.runCycle();
        assertEquals(CycleOutcome.WAITING_FOR_EXPERIMENT, waiting.outcome(), waiting.rationale());
        assertEquals(CyclePhase.EXPERIMENTING, orchestrator.state().phase);
        ABTest test = pipeline.experiments().active("default").get(0);
        assertEquals(control, test.controlModelId());
        assertEquals(ModelStatus.EXPERIMENTING, pipeline.registry().require(test.treatmentModelId()).status());

        recordSuccessRates(test, 350, 390, 500);
        clock.advance(Duration.ofHours(2));
        CycleReport adopted = orchestrator.runCycle();

        assertEquals(CycleOutcome.PROMOTED, adopted.outcome(), adopted.rationale());
        assertEquals(test.treatmentModelId(), adopted.productionModelId());
        assertEquals(ModelStatus.RETIRED, pipeline.registry().require(control).status());
        assertEquals(1, pipeline.registry().list("default", ModelStatus.PRODUCTION).size());
        PromotionAuditEntry entry = pipeline.auditLog().readAll().get(1);
        assertEquals(PromotionAuditEntry.Kind.EXPERIMENT_ADOPTED, entry.kind());
        assertEquals(test.id(), entry.testId());
        assertEquals(control, entry.previousModelId());
    }

    @Test
    void shouldRetryInconclusiveExperimentWithLongerHorizon() throws Exception {
        seed(60);
        orchestrator.runCycle();
        orchestrator.runCycle();
        ABTest first = pipeline.experiments().active("default").get(0);

        recordSuccessRates(first, 350, 352, 500);
        clock.advance(Duration.ofHours(2));
        CycleReport retried = orchestrator.runCycle();

        assertEquals(CycleOutcome.WAITING_FOR_EXPERIMENT, retried.outcome(), retried.rationale());
        ABTest second = pipeline.experiments().active("default").get(0);
        assertNotEquals(first.id(), second.id());
        assertEquals(first.treatmentModelId(), second.treatmentModelId());
        assertEquals(2, second.attempt());
        assertEquals(Duration.ofHours(2), Duration.between(second.startedAt(), second.endsAt()));
        assertEquals(2, orchestrator.state().checkpoint.experimentAttempt);

        recordSuccessRates(second, 350, 352, 500);
        clock.advance(Duration.ofHours(3));
        CycleReport rejected = orchestrator.runCycle();

        assertEquals(CycleOutcome.NOT_PROMOTED, rejected.outcome());
        assertEquals(ModelStatus.REJECTED, pipeline.registry().require(first.treatmentModelId()).status());
    }

    @Test
    void shouldGrowTrainingWindowWhenDataIsShort() throws Exception {
        seed(10);

        CycleReport first = orchestrator.runCycle();
        orchestrator.runCycle();
        orchestrator.runCycle();

        assertEquals(CycleOutcome.INSUFFICIENT_DATA, first.outcome());
        assertEquals(4, orchestrator.state().windowMultiplier);
        assertTrue(pipeline.registry().list().isEmpty());
        assertFalse(orchestrator.currentProductionModel().isPresent());
    }

    @Test
    void shouldHonourPauseUntilResumed() throws Exception {
        seed(60);
        orchestrator.pauseCycle();

        CycleReport paused = orchestrator.runCycle();
        orchestrator.resumeCycle();
        CycleReport resumed = orchestrator.runCycle();

        assertEquals(CycleOutcome.PAUSED, paused.outcome());
        assertEquals(CycleOutcome.PROMOTED, resumed.outcome(), resumed.rationale());
        assertFalse(orchestrator.state().paused);
    }

    @Test
    void shouldForcePromoteAndAbortExperimentsAgainstReplacedControl() throws Exception {
        seed(60);
        long control = orchestrator.runCycle().productionModelId();
        orchestrator.runCycle();
        ABTest running = pipeline.experiments().active("default").get(0);

        assertThrows(IllegalArgumentException.class, () -> orchestrator.forcePromote(running.treatmentModelId(), " ", "alice"));
        assertThrows(IllegalStateException.class, () -> orchestrator.forcePromote(running.treatmentModelId(), "hotfix", "alice"));
        ModelVersion hotfix = gatedModel(control);

        orchestrator.forcePromote(hotfix.id(), "hotfix for INC-991", "alice");

        assertEquals(hotfix.id(), orchestrator.currentProductionModel().orElseThrow());
        assertEquals(ABTestState.ABORTED, pipeline.experiments().find(running.id()).orElseThrow().state());
        PromotionAuditEntry forced = pipeline.auditLog().readAll().get(1);
        assertEquals(PromotionAuditEntry.Kind.FORCED, forced.kind());
        assertEquals("alice", forced.actor());
        assertEquals(control, forced.previousModelId());

        CycleReport afterAbort = orchestrator.runCycle();
        assertEquals(CycleOutcome.NOT_PROMOTED, afterAbort.outcome());
        assertEquals(hotfix.id(), afterAbort.productionModelId());
    }

    @Test
    void shouldAbortExperimentThroughOperatorControl() throws Exception {
        seed(60);
        orchestrator.runCycle();
        orchestrator.runCycle();
        ABTest running = pipeline.experiments().active("default").get(0);

        ABTest aborted = orchestrator.abortTest(running.id(), "customer complaints");

        assertEquals(ABTestState.ABORTED, aborted.state());
        assertTrue(aborted.rationale().contains("customer complaints"));
        assertThrows(IllegalArgumentException.class, () -> orchestrator.abortTest("ab-default-9999", "missing"));
    }

    @Test
    void shouldRollBackDegradedModelAndRetrain() throws Exception {
        seed(60);
        long control = orchestrator.runCycle().productionModelId();
        orchestrator.runCycle();
        ABTest test = pipeline.experiments().active("default").get(0);
        recordSuccessRates(test, 350, 390, 500);
        clock.advance(Duration.ofHours(2));
        long adopted = orchestrator.runCycle().productionModelId();
        assertEquals(test.treatmentModelId(), adopted);
        int versionsBefore = pipeline.registry().list().size();

        LearningFixtures.seedRegressed(pipeline.feedback(), pipeline.corpus(), 40, clock.instant().plusSeconds(60));
        clock.advance(Duration.ofHours(1));
        CycleReport report = orchestrator.runCycle();

        assertEquals(control, report.productionModelId());
        assertEquals(ModelStatus.PRODUCTION, pipeline.registry().require(control).status());
        assertEquals(ModelStatus.RETIRED, pipeline.registry().require(adopted).status());
        assertEquals(1, pipeline.registry().list("default", ModelStatus.PRODUCTION).size());
        List<PromotionAuditEntry> audit = pipeline.auditLog().readAll();
        PromotionAuditEntry rollback = audit.get(audit.size() - 1);
        assertEquals(PromotionAuditEntry.Kind.ROLLBACK, rollback.kind());
        assertEquals(adopted, rollback.previousModelId());
        assertEquals(control, rollback.newModelId());
        assertEquals(1.0, pipeline.metrics().total(MetricNames.MODELS_ROLLED_BACK), 1e-9);
        assertTrue(pipeline.metrics().alertHistory().stream()
                .anyMatch(alert -> alert.ruleName().equals("deployment.degraded") && alert.severity() == AlertSeverity.CRITICAL));

        CycleState state = orchestrator.state();
        assertEquals(adopted, state.checkpoint.degradedModelId);
        assertTrue(state.checkpoint.planReason.startsWith("Production model " + adopted + " degraded"), state.checkpoint.planReason);
        assertTrue(pipeline.registry().list().size() > versionsBefore);
    }

    @Test
    void shouldAnalyzeEachFamilyOverItsOwnFeedbackAndBaselines() throws Exception {
        AppConfig config = config(tempDir.resolve("families"));
        config.setFamilies(List.of(family("db", "database"), family("nas", "storage")));
        try (LearningPipeline families = new LearningPipeline(config, clock, new OkHttpClient())) {
            LearningFixtures.seedSeparable(families.feedback(), families.corpus(), 60, clock.instant().minus(Duration.ofHours(6)));
            Path patternsDir = tempDir.resolve("families").resolve("state").resolve("patterns");

            families.orchestrator("db").runCycle();
            Map<String, Baseline> dbBaselines = new BaselineStore(patternsDir.resolve("db").resolve("baselines.json")).load();
            families.orchestrator("nas").runCycle();
            Map<String, Baseline> nasBaselines = new BaselineStore(patternsDir.resolve("nas").resolve("baselines.json")).load();

            assertEquals(30, families.orchestrator("db").state().checkpoint.feedbackCount);
            assertEquals(30, families.orchestrator("nas").state().checkpoint.feedbackCount);
            assertFalse(dbBaselines.isEmpty());
            assertFalse(nasBaselines.isEmpty());
            assertTrue(dbBaselines.keySet().stream().allMatch(key -> key.startsWith("category:database|")), dbBaselines.keySet().toString());
            assertTrue(nasBaselines.keySet().stream().allMatch(key -> key.startsWith("category:storage|")), nasBaselines.keySet().toString());
            assertEquals(dbBaselines, new BaselineStore(patternsDir.resolve("db").resolve("baselines.json")).load());
        }
    }

    private static AppConfig.FamilyConfig family(String name, String category) {
        AppConfig.FamilyConfig family = new AppConfig.FamilyConfig();
        family.setName(name);
        family.setCategories(List.of(category));
        return family;
    }

    private ModelVersion gatedModel(long parentId) throws Exception {
        ModelVersion candidate = pipeline.registry().registerCandidate("default", parentId,
                TimeWindow.trailing(clock.instant(), Duration.ofDays(1)), TrainingHyperparameters.defaults(), null, null, null);
        return pipeline.registry().transition(candidate.id(), ModelStatus.GATED, "validated offline");
    }

    private void recordSuccessRates(ABTest test, int controlSuccesses, int treatmentSuccesses, int perVariant) throws Exception {
        Instant at = clock.instant();
        for (int i = 0; i < perVariant; i++) {
            pipeline.experiments().recordSample(new MetricSample(test.id(), Variant.CONTROL, ExperimentPolicy.RESOLUTION_SUCCESS,
                    i < controlSuccesses ? 1.0 : 0.0, at, "c-" + i));
            pipeline.experiments().recordSample(new MetricSample(test.id(), Variant.TREATMENT, ExperimentPolicy.RESOLUTION_SUCCESS,
                    i < treatmentSuccesses ? 1.0 : 0.0, at, "t-" + i));
        }
    }

    private void seed(int count) throws Exception {
        LearningFixtures.seedSeparable(pipeline.feedback(), pipeline.corpus(), count, clock.instant().minus(Duration.ofDays(2)));
    }

    static AppConfig config(Path root) {
        AppConfig config = new AppConfig();
        config.getStorage().setStateDir(root.resolve("state").toString());
        config.getStorage().setCorpusPath(root.resolve("state").resolve("incidents.json").toString());
        config.getFeedback().setRetrainThreshold(10);

        AppConfig.RetrainingConfig retraining = config.getRetraining();
        retraining.setMinSamples(20);
        retraining.setStabilityThreshold(0.2);
        retraining.setFeatureDimension(256);
        AppConfig.CandidateConfig candidate = new AppConfig.CandidateConfig();
        candidate.setEpochs(20);
        candidate.setLearningRate(0.5);
        candidate.setBatchSize(8);
        candidate.setL2(0.0);
        candidate.setSeed(7);
        retraining.setCandidates(List.of(candidate));

        AppConfig.ValidationConfig validation = config.getValidation();
        validation.setMaxCrossFoldStddev(0.2);
        validation.setMaxBootstrapDeviation(0.2);
        validation.setProtectedGroupings(List.of());
        validation.setMinConsistency(0.5);

        AppConfig.ExperimentConfig experiment = config.getExperiment();
        experiment.setHorizonHours(1);
        experiment.setMinSamplesPerVariant(10_000);

        config.getContinuous().setMaxRetries(0);
        config.getContinuous().setRetryBackoffMs(0);
        return config;
    }
}

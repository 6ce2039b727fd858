package com.incidentlearn.experiment;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExperimentAnalyzerTest {
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final PrimaryMetric SUCCESS = new PrimaryMetric(ExperimentPolicy.RESOLUTION_SUCCESS, MetricKind.RATE, 0.02, true);
    private static final PrimaryMetric MINUTES = new PrimaryMetric(ExperimentPolicy.RESOLUTION_MINUTES, MetricKind.CONTINUOUS, 0.0, false);
    private static final GuardRailMetric ESCALATION = new GuardRailMetric(ExperimentPolicy.ESCALATION, MetricKind.RATE, false);

    private final ExperimentAnalyzer analyzer = new ExperimentAnalyzer();

    @Test
    void shouldStayInconclusiveWhenSecondPrimaryIsFlat() {
        ABTest test = test(List.of(SUCCESS, MINUTES), List.of());
        List<MetricSample> samples = new ArrayList<>();
        samples.addAll(rate(test, Variant.CONTROL, SUCCESS.name(), 350, 500));
        samples.addAll(rate(test, Variant.TREATMENT, SUCCESS.name(), 390, 500));
        samples.addAll(minutes(test, Variant.CONTROL, 200));
        samples.addAll(minutes(test, Variant.TREATMENT, 200));

        ExperimentAnalysis analysis = analyzer.analyze(test, samples);

        assertEquals(Decision.INCONCLUSIVE, analysis.decision());
        assertEquals(0.025, analysis.adjustedAlpha(), 1e-12);
        MetricAnalysis success = analysis.metric(SUCCESS.name()).orElseThrow();
        assertTrue(success.significant());
        assertTrue(success.improvementMet());
        assertTrue(success.result().pValue() < 0.025);
        assertEquals(0.78 / 0.70 - 1.0, success.directionalImprovement(), 1e-9);
        MetricAnalysis flat = analysis.metric(MINUTES.name()).orElseThrow();
        assertFalse(flat.significant());
        assertTrue(analysis.rationale().contains(MINUTES.name()), analysis.rationale());
        assertEquals(500 + 200, analysis.controlSamples());
    }

    @Test
    void shouldAdoptWhenEveryPrimaryImproves() {
        ABTest test = test(List.of(SUCCESS), List.of(ESCALATION));
        List<MetricSample> samples = new ArrayList<>();
        samples.addAll(rate(test, Variant.CONTROL, SUCCESS.name(), 350, 500));
        samples.addAll(rate(test, Variant.TREATMENT, SUCCESS.name(), 390, 500));
        samples.addAll(rate(test, Variant.CONTROL, ESCALATION.name(), 10, 200));
        samples.addAll(rate(test, Variant.TREATMENT, ESCALATION.name(), 9, 200));

        ExperimentAnalysis analysis = analyzer.analyze(test, samples);

        assertEquals(Decision.ADOPT, analysis.decision());
        assertFalse(analysis.metric(ESCALATION.name()).orElseThrow().worse());
    }

    @Test
    void shouldRejectWhenGuardRailDegradesEvenIfPrimaryWins() {
        ABTest test = test(List.of(SUCCESS), List.of(ESCALATION));
        List<MetricSample> samples = new ArrayList<>();
        samples.addAll(rate(test, Variant.CONTROL, SUCCESS.name(), 350, 500));
        samples.addAll(rate(test, Variant.TREATMENT, SUCCESS.name(), 390, 500));
        samples.addAll(rate(test, Variant.CONTROL, ESCALATION.name(), 10, 200));
        samples.addAll(rate(test, Variant.TREATMENT, ESCALATION.name(), 40, 200));

        ExperimentAnalysis analysis = analyzer.analyze(test, samples);

        assertEquals(Decision.REJECT, analysis.decision());
        assertTrue(analysis.rationale().contains(ESCALATION.name()));
    }

    @Test
    void shouldReachSameDecisionRegardlessOfSampleOrder() {
        ABTest test = test(List.of(SUCCESS, MINUTES), List.of(ESCALATION));
        List<MetricSample> samples = new ArrayList<>();
        samples.addAll(rate(test, Variant.CONTROL, SUCCESS.name(), 340, 450));
        samples.addAll(rate(test, Variant.TREATMENT, SUCCESS.name(), 380, 470));
        samples.addAll(minutes(test, Variant.CONTROL, 120));
        samples.addAll(minutes(test, Variant.TREATMENT, 90));
        List<MetricSample> shuffled = new ArrayList<>(samples);
        Collections.shuffle(shuffled, new Random(17));

        ExperimentAnalysis first = analyzer.analyze(test, samples);
        ExperimentAnalysis second = analyzer.analyze(test, shuffled);

        assertEquals(first, second);
    }

    @Test
    void shouldIgnoreMetricsWithTooFewSamples() {
        ABTest test = test(List.of(SUCCESS), List.of());

        ExperimentAnalysis analysis = analyzer.analyze(test, rate(test, Variant.CONTROL, SUCCESS.name(), 1, 1));

        assertTrue(analysis.metric(SUCCESS.name()).orElseThrow().insufficientData());
        assertEquals(Decision.INCONCLUSIVE, analysis.decision());
    }

    @Test
    void shouldFlagHarmfulTreatmentOnlyOnceMinimumSamplesArrive() {
        ABTest test = test(List.of(SUCCESS), List.of());
        List<MetricSample> samples = new ArrayList<>();
        samples.addAll(rate(test, Variant.CONTROL, SUCCESS.name(), 390, 500));
        samples.addAll(rate(test, Variant.TREATMENT, SUCCESS.name(), 300, 500));

        ExperimentAnalyzer.EarlyStopAssessment tooEarly = analyzer.assessEarlyStop(test, samples, 1000, -0.10);
        ExperimentAnalyzer.EarlyStopAssessment harmful = analyzer.assessEarlyStop(test, samples, 100, -0.10);

        assertFalse(tooEarly.stop());
        assertTrue(harmful.stop());
        assertEquals(SUCCESS.name(), harmful.safetyViolation().orElseThrow().metricName());
        assertTrue(harmful.safetyViolation().get().directionalImprovement() <= -0.10);
    }

    @Test
    void shouldTreatBreachedGuardRailAsSafetyViolation() {
        ABTest test = test(List.of(SUCCESS), List.of(ESCALATION));
        List<MetricSample> samples = new ArrayList<>();
        samples.addAll(rate(test, Variant.CONTROL, SUCCESS.name(), 350, 500));
        samples.addAll(rate(test, Variant.TREATMENT, SUCCESS.name(), 350, 500));
        samples.addAll(rate(test, Variant.CONTROL, ESCALATION.name(), 50, 500));
        samples.addAll(rate(test, Variant.TREATMENT, ESCALATION.name(), 150, 500));

        ExperimentAnalyzer.EarlyStopAssessment assessment = analyzer.assessEarlyStop(test, samples, 100, -0.10);

        assertTrue(assessment.stop());
        MetricAnalysis breached = assessment.safetyViolation().orElseThrow();
        assertEquals(ESCALATION.name(), breached.metricName());
        assertEquals(MetricAnalysis.Role.GUARD_RAIL, breached.role());
        assertTrue(breached.directionalImprovement() < 0.0);
        assertEquals(Decision.REJECT, assessment.analysis().decision());
    }

    @Test
    void shouldStopEarlyWithRejectWhenControlWins() {
        ABTest test = test(List.of(SUCCESS), List.of());
        List<MetricSample> samples = new ArrayList<>();
        samples.addAll(rate(test, Variant.CONTROL, SUCCESS.name(), 390, 500));
        samples.addAll(rate(test, Variant.TREATMENT, SUCCESS.name(), 360, 500));

        ExperimentAnalyzer.EarlyStopAssessment assessment = analyzer.assessEarlyStop(test, samples, 100, -0.10);

        assertTrue(assessment.stop());
        assertTrue(assessment.safetyViolation().isEmpty());
        assertEquals(Decision.REJECT, assessment.analysis().decision());
        assertTrue(assessment.analysis().rationale().startsWith("Control significantly better"), assessment.analysis().rationale());
        assertEquals(Decision.INCONCLUSIVE, analyzer.analyze(test, samples).decision());
    }

    @Test
    void shouldStopEarlyForWinningTreatmentBeforePlannedSampleSize() {
        ABTest test = test(List.of(SUCCESS), List.of(), 10_000);
        List<MetricSample> samples = new ArrayList<>();
        samples.addAll(rate(test, Variant.CONTROL, SUCCESS.name(), 350, 500));
        samples.addAll(rate(test, Variant.TREATMENT, SUCCESS.name(), 390, 500));

        ExperimentAnalyzer.EarlyStopAssessment assessment = analyzer.assessEarlyStop(test, samples, 100, -0.10);
        ExperimentAnalyzer.EarlyStopAssessment flat = analyzer.assessEarlyStop(test, rate(test, Variant.CONTROL, SUCCESS.name(), 350, 500), 100, -0.10);

        assertTrue(assessment.stop());
        assertEquals(Decision.ADOPT, assessment.analysis().decision());
        assertFalse(flat.stop());
    }

    static ABTest test(List<PrimaryMetric> primaries, List<GuardRailMetric> guardRails) {
        return test(primaries, guardRails, 100);
    }

    static ABTest test(List<PrimaryMetric> primaries, List<GuardRailMetric> guardRails, long plannedPerVariant) {
        return new ABTest("ab-default-0001", "default", 1L, 2L, 0.5, primaries, guardRails, 0.05, plannedPerVariant, 1, ABTestState.RUNNING,
                T0, T0, T0.plusSeconds(7 * 86_400L), null, null, null);
    }

    static List<MetricSample> rate(ABTest test, Variant variant, String metric, int successes, int total) {
        List<MetricSample> samples = new ArrayList<>();
        for (int i = 0; i < total; i++) {
            samples.add(new MetricSample(test.id(), variant, metric, i < successes ? 1.0 : 0.0, T0.plusSeconds(i),
                    variant.name() + "-" + metric + "-" + i));
        }
        return samples;
    }

    private static List<MetricSample> minutes(ABTest test, Variant variant, int total) {
        List<MetricSample> samples = new ArrayList<>();
        for (int i = 0; i < total; i++) {
            samples.add(new MetricSample(test.id(), variant, MINUTES.name(), i % 2 == 0 ? 30.0 : 40.0, T0.plusSeconds(i),
                    variant.name() + "-minutes-" + i));
        }
        return samples;
    }
}

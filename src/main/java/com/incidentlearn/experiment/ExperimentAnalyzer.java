package com.incidentlearn.experiment;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.incidentlearn.stats.HypothesisTests;
import com.incidentlearn.stats.MultipleComparisons;
import com.incidentlearn.stats.SampleSummary;
import com.incidentlearn.stats.TestResult;

/**
 * Pure analysis of an experiment's samples. Samples are put into a canonical order first, so re-running on the
 * same samples in any arrival order produces the same decision.
 */
public class ExperimentAnalyzer {
    private static final Comparator<MetricSample> CANONICAL_ORDER = Comparator
            .comparing(MetricSample::observedAt)
            .thenComparing(MetricSample::variant)
            .thenComparing(MetricSample::metricName)
            .thenComparing(sample -> sample.subjectId() == null ? "" : sample.subjectId())
            .thenComparingDouble(MetricSample::value);

    public ExperimentAnalysis analyze(ABTest test, List<MetricSample> samples) {
        List<MetricSample> ordered = samples.stream()
                .filter(sample -> test.id().equals(sample.testId()))
                .sorted(CANONICAL_ORDER)
                .toList();
        double primaryAlpha = MultipleComparisons.bonferroni(test.significanceLevel(), Math.max(1, test.primaryMetrics().size()));
        double guardAlpha = MultipleComparisons.bonferroni(test.significanceLevel(), Math.max(1, test.guardRails().size()));

        List<MetricAnalysis> analyses = new ArrayList<>();
        for (PrimaryMetric metric : test.primaryMetrics()) {
            analyses.add(analyzeMetric(metric.name(), metric.kind(), MetricAnalysis.Role.PRIMARY, metric.higherIsBetter(),
                    metric.minRelativeImprovement(), primaryAlpha, ordered));
        }
        for (GuardRailMetric metric : test.guardRails()) {
            analyses.add(analyzeMetric(metric.name(), metric.kind(), MetricAnalysis.Role.GUARD_RAIL, metric.higherIsBetter(),
                    0.0, guardAlpha, ordered));
        }

        long controlSamples = ordered.stream().filter(sample -> sample.variant() == Variant.CONTROL).count();
        long treatmentSamples = ordered.size() - controlSamples;
        Decision decision;
        String rationale;
        List<MetricAnalysis> breached = analyses.stream()
                .filter(analysis -> analysis.role() == MetricAnalysis.Role.GUARD_RAIL && analysis.worse())
                .toList();
        List<MetricAnalysis> primaries = analyses.stream()
                .filter(analysis -> analysis.role() == MetricAnalysis.Role.PRIMARY)
                .toList();
        if (!breached.isEmpty()) {
            decision = Decision.REJECT;
            rationale = "Guard-rail metrics significantly worse: " + names(breached);
        } else if (!primaries.isEmpty() && primaries.stream().allMatch(analysis -> analysis.significant() && analysis.improvementMet())) {
            decision = Decision.ADOPT;
            rationale = "All primary metrics improved significantly: " + names(primaries);
        } else {
            decision = Decision.INCONCLUSIVE;
            List<MetricAnalysis> shortfall = primaries.stream()
                    .filter(analysis -> !(analysis.significant() && analysis.improvementMet()))
                    .toList();
            rationale = primaries.isEmpty()
                    ? "No primary metrics configured"
                    : String.format("Primary metrics without a significant required improvement at alpha=%.4f: %s",
                            primaryAlpha, names(shortfall));
        }
        return new ExperimentAnalysis(test.id(), decision, rationale, primaryAlpha, controlSamples, treatmentSamples, analyses);
    }

    /**
     * Decides whether a running test can stop before its horizon. Nothing stops until every primary metric has
     * {@code minSamplesPerVariant} samples in both variants. A primary metric harmed beyond
     * {@code maxNegativeImpact}, or a significantly worse guard rail, stops the test as a safety violation. Otherwise
     * a significant effect in either direction stops it: adopt when the treatment wins, reject when the control does.
     */
    public EarlyStopAssessment assessEarlyStop(ABTest test, List<MetricSample> samples, long minSamplesPerVariant, double maxNegativeImpact) {
        ExperimentAnalysis analysis = analyze(test, samples);
        boolean enoughData = analysis.metrics().stream()
                .filter(metric -> metric.role() == MetricAnalysis.Role.PRIMARY)
                .allMatch(metric -> hasSamples(metric, minSamplesPerVariant));
        if (!enoughData) {
            return EarlyStopAssessment.continueRunning(analysis);
        }
        Optional<MetricAnalysis> harmful = analysis.metrics().stream()
                .filter(metric -> metric.role() == MetricAnalysis.Role.PRIMARY)
                .filter(metric -> metric.significant() && metric.directionalImprovement() <= maxNegativeImpact)
                .findFirst();
        if (harmful.isPresent()) {
            return new EarlyStopAssessment(true, harmful, analysis);
        }
        Optional<MetricAnalysis> breached = breachedGuardRail(analysis)
                .filter(metric -> hasSamples(metric, minSamplesPerVariant));
        if (breached.isPresent()) {
            return new EarlyStopAssessment(true, breached, analysis);
        }
        if (analysis.decision() == Decision.ADOPT) {
            return new EarlyStopAssessment(true, Optional.empty(), analysis);
        }
        List<MetricAnalysis> controlWins = analysis.metrics().stream()
                .filter(metric -> metric.role() == MetricAnalysis.Role.PRIMARY)
                .filter(metric -> metric.significant() && metric.directionalImprovement() < 0.0)
                .toList();
        if (!controlWins.isEmpty()) {
            ExperimentAnalysis rejected = analysis.withDecision(Decision.REJECT,
                    "Control significantly better on primary metrics: " + names(controlWins));
            return new EarlyStopAssessment(true, Optional.empty(), rejected);
        }
        return EarlyStopAssessment.continueRunning(analysis);
    }

    /** The first guard rail the treatment made significantly worse, if any. */
    public static Optional<MetricAnalysis> breachedGuardRail(ExperimentAnalysis analysis) {
        return analysis.metrics().stream()
                .filter(metric -> metric.role() == MetricAnalysis.Role.GUARD_RAIL && metric.worse())
                .findFirst();
    }

    private static boolean hasSamples(MetricAnalysis metric, long minSamplesPerVariant) {
        return metric.controlCount() >= minSamplesPerVariant && metric.treatmentCount() >= minSamplesPerVariant;
    }

    private MetricAnalysis analyzeMetric(
            String name,
            MetricKind kind,
            MetricAnalysis.Role role,
            boolean higherIsBetter,
            double minRelativeImprovement,
            double alpha,
            List<MetricSample> samples) {
        double[] control = values(samples, name, Variant.CONTROL);
        double[] treatment = values(samples, name, Variant.TREATMENT);
        if (control.length < 2 || treatment.length < 2) {
            return new MetricAnalysis(name, kind, role, control.length, treatment.length, null, alpha, false, 0.0, false, false);
        }
        double confidence = 1.0 - alpha;
        TestResult result = switch (kind) {
            case CONTINUOUS -> HypothesisTests.welchTTest(SampleSummary.of(control), SampleSummary.of(treatment), confidence);
            case RATE -> HypothesisTests.twoProportionZTest(successes(control), control.length, successes(treatment), treatment.length,
                    confidence);
        };
        double directional = higherIsBetter ? result.relativeImprovement() : -result.relativeImprovement();
        boolean significant = result.significantAt(alpha);
        boolean improvementMet = directional >= minRelativeImprovement && directional > 0.0;
        boolean worse = significant && directional < 0.0;
        return new MetricAnalysis(name, kind, role, control.length, treatment.length, result, alpha, significant, directional,
                improvementMet, worse);
    }

    private static double[] values(List<MetricSample> samples, String metricName, Variant variant) {
        return samples.stream()
                .filter(sample -> sample.variant() == variant && sample.metricName().equals(metricName))
                .mapToDouble(MetricSample::value)
                .toArray();
    }

    private static long successes(double[] outcomes) {
        long count = 0;
        for (double outcome : outcomes) {
            if (outcome >= 0.5) {
                count++;
            }
        }
        return count;
    }

    private static String names(List<MetricAnalysis> analyses) {
        return analyses.stream().map(MetricAnalysis::metricName).collect(Collectors.joining(", "));
    }

    public record EarlyStopAssessment(boolean stop, Optional<MetricAnalysis> safetyViolation, ExperimentAnalysis analysis) {
        static EarlyStopAssessment continueRunning(ExperimentAnalysis analysis) {
            return new EarlyStopAssessment(false, Optional.empty(), analysis);
        }
    }
}

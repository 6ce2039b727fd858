package com.incidentlearn.validation;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import com.incidentlearn.stats.Descriptive;
import com.incidentlearn.training.MetricEstimate;
import com.incidentlearn.training.TrainingExample;

/** Cross-fold spread of the primary metric, then a bootstrap of held-out accuracy around its point estimate. */
public class StabilityCheck implements ValidationCheck {
    @Override
    public String name() {
        return "stability";
    }

    @Override
    public CheckResult run(ValidationContext context) {
        ValidationPolicy policy = context.policy();
        Map<String, Double> evidence = new HashMap<>();
        if (context.version().offlineMetrics() == null) {
            return CheckResult.fail(name(), evidence, "Model has no cross-validation results");
        }
        MetricEstimate primary = context.version().offlineMetrics().estimate(policy.primaryMetric());
        evidence.put("crossFoldStddev", primary.stddev());
        if (primary.stddev() > policy.maxCrossFoldStddev()) {
            return CheckResult.fail(name(), evidence, String.format(
                    "Cross-fold %s stddev above threshold (actual=%.4f, max=%.4f)",
                    policy.primaryMetric(), primary.stddev(), policy.maxCrossFoldStddev()));
        }

        List<TrainingExample> holdout = context.datasets().holdout();
        if (holdout.isEmpty()) {
            return CheckResult.fail(name(), evidence, "Held-out set is empty; bootstrap stability cannot be assessed");
        }
        boolean[] correct = new boolean[holdout.size()];
        int hits = 0;
        for (int i = 0; i < holdout.size(); i++) {
            correct[i] = context.model().predict(holdout.get(i)) == holdout.get(i).label();
            hits += correct[i] ? 1 : 0;
        }
        double pointEstimate = (double) hits / holdout.size();

        Random random = new Random(policy.seed());
        double[] resampled = new double[policy.bootstrapSamples()];
        for (int b = 0; b < resampled.length; b++) {
            int sampleHits = 0;
            for (int i = 0; i < correct.length; i++) {
                if (correct[random.nextInt(correct.length)]) {
                    sampleHits++;
                }
            }
            resampled[b] = (double) sampleHits / correct.length;
        }
        double low = Descriptive.percentile(resampled, 0.025);
        double high = Descriptive.percentile(resampled, 0.975);
        double deviation = Math.max(pointEstimate - low, high - pointEstimate);
        evidence.put("holdoutAccuracy", pointEstimate);
        evidence.put("bootstrapLow", low);
        evidence.put("bootstrapHigh", high);
        evidence.put("bootstrapDeviation", deviation);
        if (deviation > policy.maxBootstrapDeviation()) {
            return CheckResult.fail(name(), evidence, String.format(
                    "Bootstrap accuracy leaves tolerance band (deviation=%.4f, max=%.4f, interval=[%.4f, %.4f])",
                    deviation, policy.maxBootstrapDeviation(), low, high));
        }
        return CheckResult.pass(name(), evidence, "");
    }
}

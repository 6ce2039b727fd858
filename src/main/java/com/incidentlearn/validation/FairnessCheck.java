package com.incidentlearn.validation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.incidentlearn.training.TrainedModel;
import com.incidentlearn.training.TrainingExample;

/**
 * Demographic parity and equalized odds over each protected grouping. Groups smaller than the configured minimum
 * are left out; a grouping with fewer than two qualifying groups is skipped.
 */
public class FairnessCheck implements ValidationCheck {
    @Override
    public String name() {
        return "fairness";
    }

    @Override
    public CheckResult run(ValidationContext context) {
        ValidationPolicy policy = context.policy();
        List<TrainingExample> examples = context.unseenExamples();
        Map<String, Double> evidence = new HashMap<>();
        List<String> failures = new ArrayList<>();

        for (String grouping : policy.protectedGroupings()) {
            Map<String, GroupRates> groups = new TreeMap<>();
            for (TrainingExample example : examples) {
                String value = example.groups().get(grouping);
                if (value != null) {
                    groups.computeIfAbsent(value, ignored -> new GroupRates()).add(example, context.model());
                }
            }
            groups.values().removeIf(rates -> rates.total < policy.minGroupSize());
            evidence.put(grouping + ".groups", (double) groups.size());
            if (groups.size() < 2) {
                continue;
            }
            double parityGap = gap(groups.values().stream().map(GroupRates::positiveRate).toList());
            double tprGap = gap(groups.values().stream().filter(r -> r.positives > 0).map(GroupRates::truePositiveRate).toList());
            double fprGap = gap(groups.values().stream().filter(r -> r.negatives > 0).map(GroupRates::falsePositiveRate).toList());
            double oddsGap = Math.max(tprGap, fprGap);
            evidence.put(grouping + ".demographicParityGap", parityGap);
            evidence.put(grouping + ".equalizedOddsGap", oddsGap);
            if (parityGap > policy.fairnessTolerance()) {
                failures.add(String.format("Demographic parity gap over %s above tolerance (actual=%.4f, max=%.4f)",
                        grouping, parityGap, policy.fairnessTolerance()));
            }
            if (oddsGap > policy.fairnessTolerance()) {
                failures.add(String.format("Equalized odds gap over %s above tolerance (actual=%.4f, max=%.4f)",
                        grouping, oddsGap, policy.fairnessTolerance()));
            }
        }
        return failures.isEmpty()
                ? CheckResult.pass(name(), evidence, "")
                : CheckResult.fail(name(), evidence, String.join("; ", failures));
    }

    private static double gap(List<Double> rates) {
        if (rates.size() < 2) {
            return 0.0;
        }
        double min = rates.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        double max = rates.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        return max - min;
    }

    private static final class GroupRates {
        private int total;
        private int predictedPositive;
        private int positives;
        private int truePositives;
        private int negatives;
        private int falsePositives;

        void add(TrainingExample example, TrainedModel model) {
            boolean predicted = model.predict(example);
            total++;
            predictedPositive += predicted ? 1 : 0;
            if (example.label()) {
                positives++;
                truePositives += predicted ? 1 : 0;
            } else {
                negatives++;
                falsePositives += predicted ? 1 : 0;
            }
        }

        double positiveRate() {
            return (double) predictedPositive / total;
        }

        double truePositiveRate() {
            return (double) truePositives / positives;
        }

        double falsePositiveRate() {
            return (double) falsePositives / negatives;
        }
    }
}

package com.incidentlearn.validation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

import com.incidentlearn.training.TrainingExample;

/**
 * Perturbs incident text (dropped tokens, case changes, swapped neighbours, injected typos) and measures how often
 * the prediction survives. Examples scoring near the decision boundary are reported separately as edge cases.
 */
public class RobustnessCheck implements ValidationCheck {
    private static final double EDGE_BAND = 0.1;

    @Override
    public String name() {
        return "robustness";
    }

    @Override
    public CheckResult run(ValidationContext context) {
        ValidationPolicy policy = context.policy();
        List<TrainingExample> examples = context.datasets().holdout().isEmpty()
                ? context.datasets().future()
                : context.datasets().holdout();
        if (examples.isEmpty()) {
            return CheckResult.fail(name(), Map.of(), "No held-out examples to perturb");
        }
        Random random = new Random(policy.seed());
        int trials = 0;
        int consistent = 0;
        int edgeTrials = 0;
        int edgeConsistent = 0;
        for (TrainingExample example : examples) {
            double score = context.model().score(example);
            boolean original = score >= 0.5;
            boolean edge = Math.abs(score - 0.5) <= EDGE_BAND;
            for (int i = 0; i < policy.perturbationsPerExample(); i++) {
                TrainingExample perturbed = example.withText(perturb(example.text(), i, policy.noiseLevel(), random));
                boolean same = context.model().predict(perturbed) == original;
                trials++;
                consistent += same ? 1 : 0;
                if (edge) {
                    edgeTrials++;
                    edgeConsistent += same ? 1 : 0;
                }
            }
        }
        double consistency = (double) consistent / trials;
        Map<String, Double> evidence = new HashMap<>();
        evidence.put("consistency", consistency);
        evidence.put("perturbations", (double) trials);
        evidence.put("edgeCases", (double) edgeTrials);
        if (edgeTrials > 0) {
            evidence.put("edgeCaseConsistency", (double) edgeConsistent / edgeTrials);
        }
        if (consistency < policy.minConsistency()) {
            return CheckResult.fail(name(), evidence, String.format(
                    "Predictions unstable under perturbation (consistency=%.4f, min=%.4f)", consistency, policy.minConsistency()));
        }
        return CheckResult.pass(name(), evidence, "");
    }

    static String perturb(String text, int variant, double noiseLevel, Random random) {
        List<String> tokens = new ArrayList<>(Arrays.asList(text.trim().split("\\s+")));
        if (tokens.size() <= 1) {
            return variant % 2 == 0 ? text.toUpperCase(Locale.ROOT) : text + " ";
        }
        switch (variant % 3) {
            case 0 -> tokens.removeIf(token -> random.nextDouble() < noiseLevel);
            case 1 -> {
                for (int i = 0; i < tokens.size(); i++) {
                    if (random.nextDouble() < noiseLevel) {
                        tokens.set(i, typo(tokens.get(i), random));
                    }
                }
            }
            default -> {
                int index = random.nextInt(tokens.size() - 1);
                String first = tokens.get(index);
                tokens.set(index, tokens.get(index + 1).toUpperCase(Locale.ROOT));
                tokens.set(index + 1, first);
            }
        }
        return tokens.isEmpty() ? text : String.join(" ", tokens);
    }

    private static String typo(String token, Random random) {
        if (token.length() < 2) {
            return token;
        }
        char[] chars = token.toCharArray();
        int index = random.nextInt(chars.length - 1);
        char swap = chars[index];
        chars[index] = chars[index + 1];
        chars[index + 1] = swap;
        return new String(chars);
    }
}

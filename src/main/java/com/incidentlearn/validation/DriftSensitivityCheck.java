package com.incidentlearn.validation;

import java.util.HashMap;
import java.util.Map;

import com.incidentlearn.training.ClassificationMetrics;

/** Compares accuracy on the most recent slice, held back from training and splitting, against held-out accuracy. */
public class DriftSensitivityCheck implements ValidationCheck {
    @Override
    public String name() {
        return "drift-sensitivity";
    }

    @Override
    public CheckResult run(ValidationContext context) {
        if (context.datasets().future().isEmpty()) {
            return CheckResult.pass(name(), Map.of(), "No future slice available; drift not assessed");
        }
        double reference = context.datasets().holdout().isEmpty()
                ? context.version().offlineMetrics().accuracy().mean()
                : ClassificationMetrics.evaluate(context.model(), context.datasets().holdout()).accuracy();
        double future = ClassificationMetrics.evaluate(context.model(), context.datasets().future()).accuracy();
        double degradation = reference - future;
        Map<String, Double> evidence = new HashMap<>();
        evidence.put("referenceAccuracy", reference);
        evidence.put("futureAccuracy", future);
        evidence.put("degradation", degradation);
        if (degradation > context.policy().maxDriftDegradation()) {
            return CheckResult.fail(name(), evidence, String.format(
                    "Accuracy degrades on future slice (reference=%.4f, future=%.4f, max drop=%.4f)",
                    reference, future, context.policy().maxDriftDegradation()));
        }
        return CheckResult.pass(name(), evidence, "");
    }
}

package com.incidentlearn.validation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.incidentlearn.training.OfflineMetrics;

public class PerformanceCheck implements ValidationCheck {
    @Override
    public String name() {
        return "performance";
    }

    @Override
    public CheckResult run(ValidationContext context) {
        OfflineMetrics metrics = context.version().offlineMetrics();
        if (metrics == null) {
            return CheckResult.fail(name(), Map.of(), "Model has no offline metrics");
        }
        ValidationPolicy policy = context.policy();
        double accuracy = metrics.accuracy().mean();
        double precision = metrics.precision().mean();
        Map<String, Double> evidence = new HashMap<>();
        evidence.put("accuracy", accuracy);
        evidence.put("precision", precision);
        evidence.put("recall", metrics.recall().mean());
        evidence.put("f1", metrics.f1().mean());

        List<String> failures = new ArrayList<>();
        if (accuracy < policy.minAccuracy()) {
            failures.add(String.format("Accuracy below minimum (actual=%.4f, min=%.4f, delta=-%.4f)",
                    accuracy, policy.minAccuracy(), policy.minAccuracy() - accuracy));
        }
        if (precision < policy.minPrecision()) {
            failures.add(String.format("Precision below minimum (actual=%.4f, min=%.4f, delta=-%.4f)",
                    precision, policy.minPrecision(), policy.minPrecision() - precision));
        }
        return failures.isEmpty()
                ? CheckResult.pass(name(), evidence, "")
                : CheckResult.fail(name(), evidence, String.join("; ", failures));
    }
}

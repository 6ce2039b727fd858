package com.incidentlearn.validation;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

public record CheckResult(String name, boolean passed, boolean fatal, Map<String, Double> evidence, String rationale) {
    public CheckResult {
        evidence = evidence == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(evidence));
        rationale = rationale == null ? "" : rationale;
    }

    public static CheckResult pass(String name, Map<String, Double> evidence, String note) {
        return new CheckResult(name, true, false, evidence, note);
    }

    public static CheckResult fail(String name, Map<String, Double> evidence, String rationale) {
        return new CheckResult(name, false, false, evidence, rationale);
    }

    public static CheckResult fatal(String name, String rationale) {
        return new CheckResult(name, false, true, Map.of(), rationale);
    }
}

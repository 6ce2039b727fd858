package com.incidentlearn.validation;

import java.time.Instant;
import java.util.List;

public record ValidationReport(
        long modelVersionId,
        String family,
        List<CheckResult> checks,
        boolean passed,
        String rationale,
        Instant createdAt) {

    public ValidationReport {
        checks = checks == null ? List.of() : List.copyOf(checks);
    }
}

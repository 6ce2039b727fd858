package com.incidentlearn.patterns;

import java.util.List;
import java.util.Map;

public interface PatternDetector {
    String name();

    List<Pattern> detect(AnalysisInput input);

    /** Baseline statistics this detector wants persisted once every detector has finished. */
    default Map<String, Baseline> baselineUpdates(AnalysisInput input) {
        return Map.of();
    }
}

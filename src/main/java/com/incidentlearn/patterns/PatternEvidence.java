package com.incidentlearn.patterns;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public record PatternEvidence(Map<String, Double> statistics, List<String> sampleRecordIds, Map<String, String> notes) {
    public static final int MAX_SAMPLE_IDS = 10;

    public PatternEvidence {
        statistics = statistics == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(statistics));
        sampleRecordIds = sampleRecordIds == null
                ? List.of()
                : List.copyOf(sampleRecordIds.subList(0, Math.min(MAX_SAMPLE_IDS, sampleRecordIds.size())));
        notes = notes == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(notes));
    }
}

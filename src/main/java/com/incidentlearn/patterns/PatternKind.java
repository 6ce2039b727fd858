package com.incidentlearn.patterns;

public enum PatternKind {
    NEW_CLUSTER,
    BEHAVIOR_SHIFT,
    TREND,
    CORRELATION,
    ANOMALY
}

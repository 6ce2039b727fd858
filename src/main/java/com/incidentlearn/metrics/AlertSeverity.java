package com.incidentlearn.metrics;

public enum AlertSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}

package com.incidentlearn.model;

import java.time.Instant;

public record StatusChange(ModelStatus from, ModelStatus to, Instant at, String reason) {
}

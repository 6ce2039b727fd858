package com.incidentlearn.experiment;

public enum Variant {
    CONTROL,
    TREATMENT
}

package com.incidentlearn.experiment;

public enum Decision {
    ADOPT,
    REJECT,
    INCONCLUSIVE
}

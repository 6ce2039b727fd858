package com.incidentlearn.validation;

public interface ValidationCheck {
    String name();

    CheckResult run(ValidationContext context);
}

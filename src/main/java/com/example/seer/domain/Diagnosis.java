package com.example.seer.domain;

import com.example.seer.exception.ConsistencyViolationException;

public record Diagnosis(String rootCause, String affectedComponent, String impactExplanation, double confidence) {

    public static final String UNDER_INVESTIGATION = "Under investigation";

    public Diagnosis {
        if (rootCause == null || rootCause.isBlank()) {
            throw new ConsistencyViolationException("Diagnosis requires a root cause");
        }
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new ConsistencyViolationException("Diagnosis confidence must be within [0, 1], got " + confidence);
        }
    }

    public static Diagnosis placeholder(String affectedComponent, String impactExplanation) {
        return new Diagnosis(UNDER_INVESTIGATION, affectedComponent, impactExplanation, 0.0);
    }
}

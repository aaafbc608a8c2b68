package com.example.seer.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ActivityType {
    ANOMALY_DETECTED,
    INCIDENT_REGISTERED,
    INCIDENT_TRANSITION,
    WORKFLOW_PENDING,
    WORKFLOW_APPROVED,
    WORKFLOW_REJECTED,
    PIPELINE_STEP,
    WORKFLOW_EXECUTED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }
}

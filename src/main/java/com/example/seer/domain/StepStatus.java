package com.example.seer.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Terminal outcome of one remediation pipeline step. */
public enum StepStatus {
    COMPLETED,
    FAILED,
    SKIPPED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static StepStatus fromWire(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}

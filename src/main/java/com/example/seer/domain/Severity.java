package com.example.seer.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Incident and anomaly severity. Sev-1 is the most urgent.
 */
public enum Severity {
    SEV_1("Sev-1"),
    SEV_2("Sev-2"),
    SEV_3("Sev-3");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Accepts either the display label ("Sev-2") or the constant name ("SEV_2").
     */
    @JsonCreator
    public static Severity fromLabel(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Severity is required");
        }
        String trimmed = value.trim();
        for (Severity severity : values()) {
            if (severity.label.equalsIgnoreCase(trimmed) || severity.name().equalsIgnoreCase(trimmed)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + value);
    }
}

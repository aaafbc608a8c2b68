package com.example.seer.exception;

public class IncidentNotFoundException extends RuntimeException {
    public IncidentNotFoundException(String incidentId) {
        super("Incident not found: " + incidentId);
    }
}

package com.example.seer.exception;

import com.example.seer.domain.IncidentStatus;

public class InvalidTransitionException extends RuntimeException {

    private final IncidentStatus from;
    private final IncidentStatus to;

    public InvalidTransitionException(String incidentId, IncidentStatus from, IncidentStatus to) {
        super(String.format("Incident %s cannot move from %s to %s", incidentId, from, to));
        this.from = from;
        this.to = to;
    }

    public IncidentStatus getFrom() {
        return from;
    }

    public IncidentStatus getTo() {
        return to;
    }
}

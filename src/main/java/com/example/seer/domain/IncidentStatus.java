package com.example.seer.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Incident lifecycle. The forward path is strictly linear; the single backward
 * edge returns an incident whose remediation was rejected to manual analysis.
 */
public enum IncidentStatus {
    DETECTED,
    ANALYZING,
    AWAITING_APPROVAL,
    REMEDIATING,
    RESOLVED;

    public Set<IncidentStatus> allowedTargets() {
        return switch (this) {
            case DETECTED -> EnumSet.of(ANALYZING);
            case ANALYZING -> EnumSet.of(AWAITING_APPROVAL);
            case AWAITING_APPROVAL -> EnumSet.of(REMEDIATING, ANALYZING);
            case REMEDIATING -> EnumSet.of(RESOLVED);
            case RESOLVED -> EnumSet.noneOf(IncidentStatus.class);
        };
    }

    public boolean canTransitionTo(IncidentStatus target) {
        return target != null && allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return this == RESOLVED;
    }
}

package com.example.seer.domain;

/**
 * Execution status of a workflow, each bound to the single phase allowed to run it.
 */
public enum ExecutionPhase {
    RESEARCHING(AgentPhase.RESEARCHER),
    CORRELATING(AgentPhase.CORRELATOR),
    DIAGNOSING(AgentPhase.DIAGNOSER),
    REMEDIATING(AgentPhase.REMEDIATOR),
    AWAITING_APPROVAL(AgentPhase.APPROVER),
    COMPLETED(AgentPhase.NONE),
    FAILED(AgentPhase.NONE);

    private final AgentPhase requiredPhase;

    ExecutionPhase(AgentPhase requiredPhase) {
        this.requiredPhase = requiredPhase;
    }

    public AgentPhase requiredPhase() {
        return requiredPhase;
    }
}

package com.example.seer.domain;

import com.example.seer.exception.ConsistencyViolationException;

/**
 * Bookkeeping for which phase of a workflow is executing. A status paired
 * with the wrong phase means corrupted state and is rejected outright.
 */
public record AgentState(String workflowId, AgentPhase currentPhase, ExecutionPhase status) {

    public AgentState {
        if (workflowId == null || status == null || currentPhase == null) {
            throw new ConsistencyViolationException("AgentState requires workflowId, phase and status");
        }
        if (status.requiredPhase() != currentPhase) {
            throw new ConsistencyViolationException(String.format(
                    "Status %s requires phase %s, got %s", status, status.requiredPhase(), currentPhase));
        }
    }

    public static AgentState of(String workflowId, ExecutionPhase status) {
        return new AgentState(workflowId, status.requiredPhase(), status);
    }

    public AgentState advance(ExecutionPhase next) {
        return of(workflowId, next);
    }
}

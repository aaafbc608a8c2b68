package com.example.seer.workflow;

import com.example.seer.domain.PendingWorkflow;
import com.example.seer.domain.WorkflowExecution;

import java.util.concurrent.CompletableFuture;

/**
 * Result of answering an approval request.
 *
 * @param changed   false when the workflow already carried this answer
 * @param execution the pipeline run started by this approval, or null when none was started
 */
public record ApprovalOutcome(PendingWorkflow workflow, boolean changed,
                              CompletableFuture<WorkflowExecution> execution) {

    public boolean pipelineStarted() {
        return execution != null;
    }
}

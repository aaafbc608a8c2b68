package com.example.seer.workflow;

import com.example.seer.domain.WorkflowStepResult;
import com.example.seer.workflow.step.PipelineStep;

/**
 * Observes a pipeline run step by step.
 */
public interface StepListener {

    default void beforeStep(int stepIndex, PipelineStep step) {
    }

    void afterStep(PipelineStep step, WorkflowStepResult result);
}

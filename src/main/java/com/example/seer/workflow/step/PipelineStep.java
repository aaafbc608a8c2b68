package com.example.seer.workflow.step;

import com.example.seer.domain.ExecutionPhase;
import com.example.seer.workflow.PipelineContext;

/**
 * One stage of the remediation pipeline.
 *
 * <p>Implementations return {@link StepOutcome#skipped} when an upstream
 * step left them nothing to work with, and throw
 * {@link com.example.seer.exception.CollaboratorException} when their
 * collaborator fails; the pipeline records that as a failed step and moves on.
 */
public interface PipelineStep {

    String name();

    /** Phase the workflow is in while this step runs. */
    ExecutionPhase phase();

    default boolean isEnabled() {
        return true;
    }

    StepOutcome execute(PipelineContext context);
}

package com.example.seer.workflow;

import com.example.seer.domain.StepStatus;
import com.example.seer.domain.WorkflowStepResult;
import com.example.seer.exception.CollaboratorException;
import com.example.seer.workflow.step.PipelineStep;
import com.example.seer.workflow.step.StepOutcome;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the enabled remediation steps in order:
 * code search, fix generation, PR creation, team notification and,
 * when configured, ticket creation.
 *
 * <p>The pipeline never aborts. A step whose collaborator fails is recorded
 * as failed and the next step still runs; steps that lack upstream input
 * report themselves as skipped.
 */
@Slf4j
@Component
public class RemediationPipeline {

    private final List<PipelineStep> steps;
    private final MeterRegistry meterRegistry;

    public RemediationPipeline(List<PipelineStep> steps, MeterRegistry meterRegistry) {
        this.steps = List.copyOf(steps);
        this.meterRegistry = meterRegistry;
    }

    /** Names of the steps a run would execute with the current configuration. */
    public List<String> enabledStepNames() {
        return enabledSteps().stream().map(PipelineStep::name).toList();
    }

    public List<WorkflowStepResult> run(PipelineContext context, StepListener listener) {
        List<PipelineStep> enabled = enabledSteps();
        List<WorkflowStepResult> results = new ArrayList<>(enabled.size());

        int index = 0;
        for (PipelineStep step : enabled) {
            index++;
            listener.beforeStep(index, step);
            StepOutcome outcome = runStep(step, context);
            WorkflowStepResult result = new WorkflowStepResult(index, step.name(), outcome.status(), outcome.detail());
            results.add(result);

            meterRegistry.counter("seer.pipeline.steps",
                    "step", step.name(), "status", outcome.status().name().toLowerCase()).increment();
            listener.afterStep(step, result);
        }
        return results;
    }

    private StepOutcome runStep(PipelineStep step, PipelineContext context) {
        log.info("Incident {}: running step {}", context.incidentId(), step.name());
        try {
            StepOutcome outcome = step.execute(context);
            if (outcome.status() == StepStatus.SKIPPED) {
                log.info("Incident {}: step {} skipped: {}", context.incidentId(), step.name(), outcome.detail());
            }
            return outcome;
        } catch (CollaboratorException e) {
            log.warn("Incident {}: step {} failed: {}", context.incidentId(), step.name(), e.getMessage());
            return StepOutcome.failed(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Incident {}: step {} crashed", context.incidentId(), step.name(), e);
            return StepOutcome.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private List<PipelineStep> enabledSteps() {
        return steps.stream().filter(PipelineStep::isEnabled).toList();
    }
}

package com.example.seer.workflow;

import com.example.seer.domain.ExecutionPhase;
import com.example.seer.domain.IncidentRecord;
import com.example.seer.domain.StepStatus;
import com.example.seer.domain.WorkflowStepResult;
import com.example.seer.exception.CollaboratorException;
import com.example.seer.workflow.step.PipelineStep;
import com.example.seer.workflow.step.StepOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class RemediationPipelineTest {

    private static PipelineStep step(String name, boolean enabled, Function<PipelineContext, StepOutcome> body) {
        return new PipelineStep() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public ExecutionPhase phase() {
                return ExecutionPhase.REMEDIATING;
            }

            @Override
            public boolean isEnabled() {
                return enabled;
            }

            @Override
            public StepOutcome execute(PipelineContext context) {
                return body.apply(context);
            }
        };
    }

    private static PipelineContext context() {
        return new PipelineContext(IncidentRecord.builder().id("INC-1001").service("api").build(), null);
    }

    @Test
    void runsEveryEnabledStepInOrderEvenAfterFailures() {
        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        RemediationPipeline pipeline = new RemediationPipeline(List.of(
                step("first", true, c -> StepOutcome.completed("ok")),
                step("second", true, c -> {
                    throw new CollaboratorException("second", "down");
                }),
                step("disabled", false, c -> StepOutcome.completed("never")),
                step("third", true, c -> StepOutcome.skipped("nothing to do"))), meters);

        List<String> seen = new ArrayList<>();
        List<WorkflowStepResult> results = pipeline.run(context(), (step, result) -> seen.add(step.name()));

        assertThat(results).extracting(WorkflowStepResult::name).containsExactly("first", "second", "third");
        assertThat(results).extracting(WorkflowStepResult::stepIndex).containsExactly(1, 2, 3);
        assertThat(results).extracting(WorkflowStepResult::status)
                .containsExactly(StepStatus.COMPLETED, StepStatus.FAILED, StepStatus.SKIPPED);
        assertThat(results.get(1).detail()).contains("down");
        assertThat(seen).containsExactly("first", "second", "third");
        assertThat(meters.counter("seer.pipeline.steps", "step", "second", "status", "failed").count()).isEqualTo(1.0);
    }

    @Test
    void enabledStepNamesReflectConfiguration() {
        RemediationPipeline pipeline = new RemediationPipeline(List.of(
                step("a", true, c -> StepOutcome.completed("")),
                step("b", false, c -> StepOutcome.completed(""))), new SimpleMeterRegistry());

        assertThat(pipeline.enabledStepNames()).containsExactly("a");
    }
}

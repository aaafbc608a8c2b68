package com.example.seer.domain;

import com.example.seer.exception.ConsistencyViolationException;

import java.util.List;

public record PipelineSummary(int totalSteps, int completed, int failed, int skipped) {

    public PipelineSummary {
        if (completed + failed + skipped != totalSteps) {
            throw new ConsistencyViolationException(String.format(
                    "Step outcomes (%d completed, %d failed, %d skipped) do not add up to %d steps",
                    completed, failed, skipped, totalSteps));
        }
    }

    public static PipelineSummary of(List<WorkflowStepResult> steps) {
        int completed = 0;
        int failed = 0;
        int skipped = 0;
        for (WorkflowStepResult step : steps) {
            switch (step.status()) {
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
            }
        }
        return new PipelineSummary(steps.size(), completed, failed, skipped);
    }

    public boolean allCompleted() {
        return totalSteps > 0 && completed == totalSteps;
    }
}

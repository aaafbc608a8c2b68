package com.example.seer.workflow.step;

import com.example.seer.domain.StepStatus;

public record StepOutcome(StepStatus status, String detail) {

    public static StepOutcome completed(String detail) {
        return new StepOutcome(StepStatus.COMPLETED, detail);
    }

    public static StepOutcome skipped(String detail) {
        return new StepOutcome(StepStatus.SKIPPED, detail);
    }

    public static StepOutcome failed(String detail) {
        return new StepOutcome(StepStatus.FAILED, detail);
    }
}

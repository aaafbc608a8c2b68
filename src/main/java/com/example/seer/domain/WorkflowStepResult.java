package com.example.seer.domain;

public record WorkflowStepResult(int stepIndex, String name, StepStatus status, String detail) {

    public static WorkflowStepResult completed(int index, String name, String detail) {
        return new WorkflowStepResult(index, name, StepStatus.COMPLETED, detail);
    }

    public static WorkflowStepResult failed(int index, String name, String detail) {
        return new WorkflowStepResult(index, name, StepStatus.FAILED, detail);
    }

    public static WorkflowStepResult skipped(int index, String name, String detail) {
        return new WorkflowStepResult(index, name, StepStatus.SKIPPED, detail);
    }
}

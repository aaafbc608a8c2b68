package com.example.seer.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum WorkflowApprovalStatus {
    PENDING_APPROVAL,
    APPROVED,
    REJECTED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }

    public boolean isTerminal() {
        return this != PENDING_APPROVAL;
    }
}

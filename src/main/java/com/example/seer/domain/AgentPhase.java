package com.example.seer.domain;

/** Which part of the remediation workflow currently owns an execution. */
public enum AgentPhase {
    RESEARCHER,
    CORRELATOR,
    DIAGNOSER,
    REMEDIATOR,
    APPROVER,
    NONE
}

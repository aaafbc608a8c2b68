package com.example.seer.domain;

import com.example.seer.domain.converter.StepResultsConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Records one run of the remediation pipeline.
 */
@Entity
@Table(name = "workflow_executions", indexes = {
        @Index(name = "idx_execution_incident", columnList = "incident_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowExecution {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "workflow_id", nullable = false)
    private String workflowId;

    @Column(name = "incident_id", nullable = false)
    private String incidentId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ExecutionStatus status;

    @Convert(converter = StepResultsConverter.class)
    @Column(length = 16384)
    @Builder.Default
    private List<WorkflowStepResult> steps = new ArrayList<>();

    @Column(name = "total_steps")
    private int totalSteps;

    @Column(name = "completed_steps")
    private int completedSteps;

    @Column(name = "failed_steps")
    private int failedSteps;

    @Column(name = "skipped_steps")
    private int skippedSteps;

    @Column(name = "pr_url")
    private String prUrl;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "execution_time_ms")
    private Long executionTimeMs;

    public enum ExecutionStatus {
        RUNNING, SUCCESS, PARTIAL, FAILED
    }

    public PipelineSummary summary() {
        return new PipelineSummary(totalSteps, completedSteps, failedSteps, skippedSteps);
    }
}

package com.example.seer.workflow;

import com.example.seer.activity.ActivityLogService;
import com.example.seer.domain.ActivityLogEntry;
import com.example.seer.domain.ActivityType;
import com.example.seer.domain.AgentState;
import com.example.seer.domain.AnomalyResult;
import com.example.seer.domain.ExecutionPhase;
import com.example.seer.domain.IncidentRecord;
import com.example.seer.domain.IncidentStatus;
import com.example.seer.domain.PendingWorkflow;
import com.example.seer.domain.PipelineSummary;
import com.example.seer.domain.Remediation;
import com.example.seer.domain.WorkflowApprovalStatus;
import com.example.seer.domain.WorkflowExecution;
import com.example.seer.domain.WorkflowStepResult;
import com.example.seer.exception.WorkflowNotFoundException;
import com.example.seer.gateway.EventBroadcaster;
import com.example.seer.incident.IncidentRegistry;
import com.example.seer.incident.KeyedLocks;
import com.example.seer.incident.NewIncident;
import com.example.seer.repository.PendingWorkflowRepository;
import com.example.seer.repository.WorkflowExecutionRepository;
import com.example.seer.workflow.step.PipelineStep;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Turns anomalies into approval-gated remediation workflows.
 *
 * <p>An anomaly opens an incident and parks it in AWAITING_APPROVAL behind a
 * pending workflow. Approval moves the incident to REMEDIATING and starts the
 * pipeline on the pipeline executor; rejection sends it back to ANALYZING for
 * manual handling. At most one pipeline runs per incident at a time.
 */
@Slf4j
@Service
public class WorkflowOrchestrator {

    private static final String LOCK_PREFIX = "workflow:";

    private final IncidentRegistry incidentRegistry;
    private final PendingWorkflowRepository workflowRepository;
    private final WorkflowExecutionRepository executionRepository;
    private final RemediationPipeline pipeline;
    private final ActivityLogService activityLog;
    private final EventBroadcaster events;
    private final KeyedLocks locks;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Executor pipelineExecutor;

    private final Set<String> activeIncidents = ConcurrentHashMap.newKeySet();
    private final Map<String, AgentState> agentStates = new ConcurrentHashMap<>();

    public WorkflowOrchestrator(IncidentRegistry incidentRegistry,
                                PendingWorkflowRepository workflowRepository,
                                WorkflowExecutionRepository executionRepository,
                                RemediationPipeline pipeline,
                                ActivityLogService activityLog,
                                EventBroadcaster events,
                                KeyedLocks locks,
                                MeterRegistry meterRegistry,
                                Clock clock,
                                @Qualifier("pipelineExecutor") Executor pipelineExecutor) {
        this.incidentRegistry = incidentRegistry;
        this.workflowRepository = workflowRepository;
        this.executionRepository = executionRepository;
        this.pipeline = pipeline;
        this.activityLog = activityLog;
        this.events = events;
        this.locks = locks;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.pipelineExecutor = pipelineExecutor;
    }

    /**
     * Open an incident for the anomaly and a pending workflow awaiting approval.
     */
    public PendingWorkflow onAnomaly(AnomalyResult anomaly) {
        IncidentRecord incident = incidentRegistry.register(NewIncident.builder()
                .title(titleFor(anomaly))
                .service(anomaly.service())
                .severity(anomaly.severity())
                .description(describe(anomaly))
                .environment(anomaly.environment())
                .affectedComponent(anomaly.service())
                .source("monitoring")
                .anomaly(anomaly)
                .build());
        String incidentId = incident.getId();

        incidentRegistry.transition(incidentId, IncidentStatus.ANALYZING, "monitoring",
                "Anomaly on " + anomaly.metric() + " under analysis");

        PendingWorkflow workflow = workflowRepository.save(PendingWorkflow.builder()
                .incidentId(incidentId)
                .anomaly(anomaly)
                .status(WorkflowApprovalStatus.PENDING_APPROVAL)
                .actions(new ArrayList<>(pipeline.enabledStepNames()))
                .createdAt(clock.instant())
                .build());
        agentStates.put(workflow.getId(), AgentState.of(workflow.getId(), ExecutionPhase.AWAITING_APPROVAL));

        incidentRegistry.transition(incidentId, IncidentStatus.AWAITING_APPROVAL, "monitoring",
                "Remediation workflow " + workflow.getId() + " awaiting approval");

        log.info("Workflow {} pending approval for incident {} ({} on {})",
                workflow.getId(), incidentId, anomaly.metric(), anomaly.service());
        activityLog.record(ActivityType.WORKFLOW_PENDING, "monitoring",
                "Remediation for " + incidentId + " awaiting approval",
                Map.of("workflow_id", workflow.getId(),
                        "incident_id", incidentId,
                        "actions", workflow.getActions()),
                ActivityLogEntry.Outcome.PENDING);
        events.broadcast("workflow.pending", Map.of(
                "workflow_id", workflow.getId(),
                "incident_id", incidentId,
                "severity", anomaly.severity().getLabel(),
                "actions", workflow.getActions()));
        return workflow;
    }

    /**
     * Answer an approval request. Repeating the answer a workflow already has
     * is a no-op; contradicting it is an error.
     *
     * @throws IllegalStateException when approving a rejected workflow or rejecting an approved one
     */
    public ApprovalOutcome respond(String workflowId, boolean approved, String reason, String respondedBy) {
        return locks.withLock(LOCK_PREFIX + workflowId, () -> {
            PendingWorkflow workflow = get(workflowId);
            WorkflowApprovalStatus target = approved ? WorkflowApprovalStatus.APPROVED : WorkflowApprovalStatus.REJECTED;

            if (workflow.getStatus() == target) {
                log.debug("Workflow {} already {}, ignoring repeated answer", workflowId, target);
                return new ApprovalOutcome(workflow, false, null);
            }
            if (workflow.getStatus().isTerminal()) {
                throw new IllegalStateException(String.format(
                        "Workflow %s is already %s and cannot be %s",
                        workflowId, workflow.getStatus(), approved ? "approved" : "rejected"));
            }
            return approved ? approve(workflow, reason, respondedBy) : reject(workflow, reason, respondedBy);
        });
    }

    /**
     * Run the pipeline again for an approved workflow whose incident is still
     * under remediation, e.g. after a collaborator outage.
     */
    public CompletableFuture<WorkflowExecution> rerun(String workflowId, String requestedBy) {
        PendingWorkflow workflow = get(workflowId);
        if (workflow.getStatus() != WorkflowApprovalStatus.APPROVED) {
            throw new IllegalStateException("Workflow " + workflowId + " is " + workflow.getStatus() + ", not approved");
        }
        IncidentRecord incident = incidentRegistry.get(workflow.getIncidentId());
        if (incident.getStatus() != IncidentStatus.REMEDIATING) {
            throw new IllegalStateException("Incident " + incident.getId() + " is " + incident.getStatus()
                    + ", pipeline can only re-run while REMEDIATING");
        }
        log.info("Re-running pipeline for workflow {} (requested by {})", workflowId, requestedBy);
        return launch(workflow);
    }

    public PendingWorkflow get(String workflowId) {
        return workflowRepository.findById(workflowId).orElseThrow(() -> new WorkflowNotFoundException(workflowId));
    }

    public List<PendingWorkflow> getPending() {
        return workflowRepository.findByStatusOrderByCreatedAtDesc(WorkflowApprovalStatus.PENDING_APPROVAL);
    }

    public List<WorkflowExecution> getExecutions(String incidentId) {
        return executionRepository.findByIncidentIdOrderByStartedAtDesc(incidentId);
    }

    public Optional<AgentState> getAgentState(String workflowId) {
        return Optional.ofNullable(agentStates.get(workflowId));
    }

    public boolean isPipelineActive(String incidentId) {
        return activeIncidents.contains(incidentId);
    }

    private ApprovalOutcome approve(PendingWorkflow workflow, String reason, String respondedBy) {
        String actor = respondedBy != null ? respondedBy : "unknown";
        incidentRegistry.transition(workflow.getIncidentId(), IncidentStatus.REMEDIATING, actor,
                "Remediation approved by " + actor);

        workflow.setStatus(WorkflowApprovalStatus.APPROVED);
        workflow.setApprovedAt(clock.instant());
        workflow.setApprovalReason(reason);
        workflow.setRespondedBy(actor);
        PendingWorkflow saved = workflowRepository.save(workflow);

        log.info("Workflow {} approved by {}", saved.getId(), actor);
        activityLog.record(ActivityType.WORKFLOW_APPROVED, actor,
                "Remediation for " + saved.getIncidentId() + " approved",
                details(saved, reason));
        events.broadcast("workflow.approved", details(saved, reason));

        return new ApprovalOutcome(saved, true, launch(saved));
    }

    private ApprovalOutcome reject(PendingWorkflow workflow, String reason, String respondedBy) {
        String actor = respondedBy != null ? respondedBy : "unknown";
        incidentRegistry.transition(workflow.getIncidentId(), IncidentStatus.ANALYZING, actor,
                "Remediation rejected" + (reason != null ? ": " + reason : ""));

        workflow.setStatus(WorkflowApprovalStatus.REJECTED);
        workflow.setRejectedAt(clock.instant());
        workflow.setRejectionReason(reason);
        workflow.setRespondedBy(actor);
        PendingWorkflow saved = workflowRepository.save(workflow);
        agentStates.put(saved.getId(), AgentState.of(saved.getId(), ExecutionPhase.FAILED));

        log.info("Workflow {} rejected by {}: {}", saved.getId(), actor, reason);
        activityLog.record(ActivityType.WORKFLOW_REJECTED, actor,
                "Remediation for " + saved.getIncidentId() + " rejected",
                details(saved, reason));
        events.broadcast("workflow.rejected", details(saved, reason));
        return new ApprovalOutcome(saved, true, null);
    }

    private CompletableFuture<WorkflowExecution> launch(PendingWorkflow workflow) {
        String incidentId = workflow.getIncidentId();
        if (!activeIncidents.add(incidentId)) {
            throw new IllegalStateException("A remediation pipeline is already running for incident " + incidentId);
        }
        try {
            return CompletableFuture.supplyAsync(() -> execute(workflow), pipelineExecutor)
                    .whenComplete((execution, error) -> activeIncidents.remove(incidentId));
        } catch (RejectedExecutionException e) {
            activeIncidents.remove(incidentId);
            throw new IllegalStateException("Pipeline executor is saturated, retry later", e);
        }
    }

    WorkflowExecution execute(PendingWorkflow workflow) {
        Timer.Sample sample = Timer.start(meterRegistry);
        Instant startedAt = clock.instant();
        String workflowId = workflow.getId();
        String incidentId = workflow.getIncidentId();

        WorkflowExecution execution = executionRepository.save(WorkflowExecution.builder()
                .workflowId(workflowId)
                .incidentId(incidentId)
                .status(WorkflowExecution.ExecutionStatus.RUNNING)
                .startedAt(startedAt)
                .build());
        log.info("Starting remediation pipeline for incident {} (workflow {})", incidentId, workflowId);
        events.broadcast("pipeline.started", Map.of(
                "workflow_id", workflowId, "incident_id", incidentId, "execution_id", execution.getId()));

        try {
            IncidentRecord incident = incidentRegistry.get(incidentId);
            PipelineContext context = new PipelineContext(incident, workflow.getAnomaly());
            List<WorkflowStepResult> results = pipeline.run(context, new ExecutionTracker(execution));

            PipelineSummary summary = PipelineSummary.of(results);
            finish(execution, results, summary, context, startedAt);
            applyOutcome(incidentId, context, summary);

            agentStates.put(workflowId, AgentState.of(workflowId,
                    summary.completed() > 0 ? ExecutionPhase.COMPLETED : ExecutionPhase.FAILED));
            activityLog.record(ActivityType.WORKFLOW_EXECUTED, "pipeline",
                    String.format("Pipeline for %s finished: %d/%d steps completed",
                            incidentId, summary.completed(), summary.totalSteps()),
                    summaryDetails(execution, summary),
                    summary.allCompleted() ? ActivityLogEntry.Outcome.SUCCESS : ActivityLogEntry.Outcome.FAILED);
            events.broadcast("pipeline.completed", summaryDetails(execution, summary));
            log.info("Pipeline for incident {} finished {}: {} completed, {} failed, {} skipped",
                    incidentId, execution.getStatus(), summary.completed(), summary.failed(), summary.skipped());
        } catch (RuntimeException e) {
            log.error("Pipeline for incident {} aborted unexpectedly", incidentId, e);
            execution.setStatus(WorkflowExecution.ExecutionStatus.FAILED);
            execution.setCompletedAt(clock.instant());
            execution.setExecutionTimeMs(Duration.between(startedAt, execution.getCompletedAt()).toMillis());
            execution = executionRepository.save(execution);
            agentStates.put(workflowId, AgentState.of(workflowId, ExecutionPhase.FAILED));
        } finally {
            sample.stop(meterRegistry.timer("seer.pipeline.duration", "status", execution.getStatus().name()));
        }
        return execution;
    }

    private void finish(WorkflowExecution execution, List<WorkflowStepResult> results, PipelineSummary summary,
                        PipelineContext context, Instant startedAt) {
        Instant completedAt = clock.instant();
        execution.setSteps(new ArrayList<>(results));
        execution.setTotalSteps(summary.totalSteps());
        execution.setCompletedSteps(summary.completed());
        execution.setFailedSteps(summary.failed());
        execution.setSkippedSteps(summary.skipped());
        execution.setPrUrl(context.getPullRequest() != null ? context.getPullRequest().prUrl() : null);
        execution.setCompletedAt(completedAt);
        execution.setExecutionTimeMs(Duration.between(startedAt, completedAt).toMillis());
        if (summary.allCompleted()) {
            execution.setStatus(WorkflowExecution.ExecutionStatus.SUCCESS);
        } else if (summary.completed() > 0) {
            execution.setStatus(WorkflowExecution.ExecutionStatus.PARTIAL);
        } else {
            execution.setStatus(WorkflowExecution.ExecutionStatus.FAILED);
        }
        executionRepository.save(execution);
    }

    /**
     * A shipped fix is always recorded; the incident is only closed when
     * every enabled step completed.
     */
    private void applyOutcome(String incidentId, PipelineContext context, PipelineSummary summary) {
        if (!context.hasShippedFix()) {
            log.info("Incident {} stays REMEDIATING: no fix was shipped", incidentId);
            return;
        }
        Remediation remediation = new Remediation(
                context.getTargetFile().filePath(),
                context.getFix().explanation(),
                context.getPullRequest().prNumber(),
                context.getPullRequest().prUrl(),
                context.getPullRequest().branch());
        incidentRegistry.attachRemediation(incidentId, remediation);

        if (summary.allCompleted()) {
            incidentRegistry.resolve(incidentId, null, remediation, clock.instant());
        } else {
            log.info("Incident {} stays REMEDIATING: {} of {} steps did not complete",
                    incidentId, summary.totalSteps() - summary.completed(), summary.totalSteps());
        }
    }

    private static String titleFor(AnomalyResult anomaly) {
        return anomaly.metric() + " anomaly on " + anomaly.service();
    }

    private static String describe(AnomalyResult anomaly) {
        if (anomaly.isUnbounded()) {
            return String.format("%s reached %.2f against a flat baseline of %.2f",
                    anomaly.metric(), anomaly.currentValue(), anomaly.expectedValue());
        }
        return String.format("%s reached %.2f against a baseline of %.2f ± %.2f (%.1fσ)",
                anomaly.metric(), anomaly.currentValue(), anomaly.expectedValue(),
                anomaly.baselineStddev(), anomaly.deviationSigma());
    }

    private static Map<String, Object> details(PendingWorkflow workflow, String reason) {
        Map<String, Object> details = new HashMap<>();
        details.put("workflow_id", workflow.getId());
        details.put("incident_id", workflow.getIncidentId());
        details.put("status", workflow.getStatus().wireValue());
        if (workflow.getRespondedBy() != null) details.put("responded_by", workflow.getRespondedBy());
        if (reason != null) details.put("reason", reason);
        return details;
    }

    private static Map<String, Object> summaryDetails(WorkflowExecution execution, PipelineSummary summary) {
        Map<String, Object> details = new HashMap<>();
        details.put("workflow_id", execution.getWorkflowId());
        details.put("incident_id", execution.getIncidentId());
        details.put("execution_id", execution.getId());
        details.put("status", execution.getStatus().name());
        details.put("total_steps", summary.totalSteps());
        details.put("completed", summary.completed());
        details.put("failed", summary.failed());
        details.put("skipped", summary.skipped());
        if (execution.getPrUrl() != null) details.put("pr_url", execution.getPrUrl());
        return details;
    }

    /** Persists step results and agent phase as the run progresses. */
    private final class ExecutionTracker implements StepListener {

        private final WorkflowExecution execution;

        private ExecutionTracker(WorkflowExecution execution) {
            this.execution = execution;
        }

        @Override
        public void beforeStep(int stepIndex, PipelineStep step) {
            agentStates.put(execution.getWorkflowId(), AgentState.of(execution.getWorkflowId(), step.phase()));
        }

        @Override
        public void afterStep(PipelineStep step, WorkflowStepResult result) {
            List<WorkflowStepResult> steps = new ArrayList<>(execution.getSteps());
            steps.add(result);
            execution.setSteps(steps);
            executionRepository.save(execution);

            Map<String, Object> details = new HashMap<>();
            details.put("incident_id", execution.getIncidentId());
            details.put("workflow_id", execution.getWorkflowId());
            details.put("step_index", result.stepIndex());
            details.put("step", result.name());
            details.put("status", result.status().wireValue());
            details.put("detail", result.detail() != null ? result.detail() : "");

            ActivityLogEntry.Outcome outcome = switch (result.status()) {
                case COMPLETED -> ActivityLogEntry.Outcome.SUCCESS;
                case FAILED -> ActivityLogEntry.Outcome.FAILED;
                case SKIPPED -> ActivityLogEntry.Outcome.SKIPPED;
            };
            activityLog.record(ActivityType.PIPELINE_STEP, "pipeline",
                    String.format("Step %d %s %s for %s", result.stepIndex(), result.name(),
                            result.status().wireValue(), execution.getIncidentId()),
                    details, outcome);
            events.broadcast("pipeline.step", details);
        }
    }
}

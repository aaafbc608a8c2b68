package com.example.seer.controller;

import com.example.seer.domain.PendingWorkflow;
import com.example.seer.domain.WorkflowExecution;
import com.example.seer.monitoring.IterationReport;
import com.example.seer.monitoring.MonitoringService;
import com.example.seer.monitoring.MonitoringStatus;
import com.example.seer.workflow.ApprovalOutcome;
import com.example.seer.workflow.WorkflowOrchestrator;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Monitoring loop control and the approval gate for remediation workflows.
 */
@RestController
@RequestMapping("/api/observer")
@RequiredArgsConstructor
public class ObserverController {

    private final MonitoringService monitoringService;
    private final WorkflowOrchestrator orchestrator;
    private final Clock clock;

    @PostMapping("/start")
    public ResponseEntity<Map<String, Object>> start() {
        boolean started = monitoringService.start();
        return ResponseEntity.ok(Map.of(
                "running", monitoringService.isRunning(),
                "message", started ? "Monitoring started" : "Monitoring already running"));
    }

    @PostMapping("/stop")
    public ResponseEntity<Map<String, Object>> stop() {
        boolean stopped = monitoringService.stop();
        return ResponseEntity.ok(Map.of(
                "running", monitoringService.isRunning(),
                "message", stopped ? "Monitoring stopped" : "Monitoring was not running"));
    }

    @GetMapping("/status")
    public ResponseEntity<MonitoringStatus> status() {
        return ResponseEntity.ok(monitoringService.getStatus());
    }

    /**
     * Run one iteration now, independent of the schedule.
     */
    @PostMapping("/check")
    public ResponseEntity<IterationReport> checkNow() {
        return ResponseEntity.ok(monitoringService.runIteration(clock.instant()));
    }

    @GetMapping("/workflows/pending")
    public ResponseEntity<List<PendingWorkflow>> pendingWorkflows() {
        return ResponseEntity.ok(orchestrator.getPending());
    }

    @GetMapping("/workflows/{id}")
    public ResponseEntity<Map<String, Object>> getWorkflow(@PathVariable String id) {
        PendingWorkflow workflow = orchestrator.get(id);
        Map<String, Object> body = new HashMap<>();
        body.put("workflow", workflow);
        orchestrator.getAgentState(id).ifPresent(state -> body.put("agent_state", state));
        body.put("pipeline_active", orchestrator.isPipelineActive(workflow.getIncidentId()));
        body.put("executions", orchestrator.getExecutions(workflow.getIncidentId()));
        return ResponseEntity.ok(body);
    }

    /**
     * Approve or reject a pending workflow. Approval starts the pipeline in
     * the background; poll the incident for its outcome.
     */
    @PostMapping("/workflows/approve")
    public ResponseEntity<Map<String, Object>> respond(@RequestBody ApprovalRequest request) {
        if (request.workflowId() == null || request.approved() == null) {
            throw new IllegalArgumentException("workflow_id and approved are required");
        }
        ApprovalOutcome outcome = orchestrator.respond(
                request.workflowId(), request.approved(), request.reason(),
                request.respondedBy() != null ? request.respondedBy() : "user");

        Map<String, Object> body = new HashMap<>();
        body.put("workflow_id", outcome.workflow().getId());
        body.put("incident_id", outcome.workflow().getIncidentId());
        body.put("status", outcome.workflow().getStatus());
        body.put("changed", outcome.changed());
        body.put("pipeline_started", outcome.pipelineStarted());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/workflows/{id}/rerun")
    public ResponseEntity<Map<String, Object>> rerun(@PathVariable String id,
                                                     @RequestParam(defaultValue = "user") String requestedBy) {
        PendingWorkflow workflow = orchestrator.get(id);
        orchestrator.rerun(id, requestedBy);
        return ResponseEntity.accepted().body(Map.of(
                "workflow_id", id,
                "incident_id", workflow.getIncidentId(),
                "pipeline_started", true));
    }

    @GetMapping("/incidents/{incidentId}/executions")
    public ResponseEntity<List<WorkflowExecution>> executions(@PathVariable String incidentId) {
        return ResponseEntity.ok(orchestrator.getExecutions(incidentId));
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ApprovalRequest(String workflowId, Boolean approved, String reason, String respondedBy) {
    }
}

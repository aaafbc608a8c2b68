package com.example.seer.workflow;

import com.example.seer.activity.ActivityLogService;
import com.example.seer.collaborator.CodeFile;
import com.example.seer.collaborator.CodeFixGenerator;
import com.example.seer.collaborator.CodeFixResult;
import com.example.seer.collaborator.CodeSearchClient;
import com.example.seer.collaborator.NotificationReceipt;
import com.example.seer.collaborator.NotificationSender;
import com.example.seer.collaborator.PullRequestCreator;
import com.example.seer.collaborator.PullRequestResult;
import com.example.seer.collaborator.TicketCreator;
import com.example.seer.config.SeerProperties;
import com.example.seer.domain.ActivityType;
import com.example.seer.domain.AnomalyResult;
import com.example.seer.domain.ExecutionPhase;
import com.example.seer.domain.IncidentRecord;
import com.example.seer.domain.IncidentStatus;
import com.example.seer.domain.PendingWorkflow;
import com.example.seer.domain.Severity;
import com.example.seer.domain.StepStatus;
import com.example.seer.domain.WorkflowApprovalStatus;
import com.example.seer.domain.WorkflowExecution;
import com.example.seer.domain.WorkflowStepResult;
import com.example.seer.exception.CollaboratorException;
import com.example.seer.exception.WorkflowNotFoundException;
import com.example.seer.gateway.EventBroadcaster;
import com.example.seer.incident.IncidentIdAllocator;
import com.example.seer.incident.IncidentRegistry;
import com.example.seer.incident.KeyedLocks;
import com.example.seer.repository.IncidentRecordRepository;
import com.example.seer.support.InMemoryRepositories;
import com.example.seer.support.MutableClock;
import com.example.seer.workflow.step.CodeSearchStep;
import com.example.seer.workflow.step.FixGenerationStep;
import com.example.seer.workflow.step.NotifyTeamStep;
import com.example.seer.workflow.step.PullRequestStep;
import com.example.seer.workflow.step.TicketStep;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WorkflowOrchestratorTest {

    private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");

    private final SeerProperties properties = new SeerProperties();
    private final MutableClock clock = new MutableClock(START);

    private Map<String, IncidentRecord> incidents;
    private Map<String, PendingWorkflow> workflows;
    private Map<String, WorkflowExecution> executions;

    private CodeSearchClient codeSearch;
    private CodeFixGenerator fixGenerator;
    private PullRequestCreator pullRequestCreator;
    private NotificationSender notificationSender;
    private TicketCreator ticketCreator;
    private ActivityLogService activityLog;

    private IncidentRegistry registry;

    @BeforeEach
    void setUp() {
        incidents = InMemoryRepositories.newStore();
        workflows = InMemoryRepositories.newStore();
        executions = InMemoryRepositories.newStore();

        codeSearch = mock(CodeSearchClient.class);
        fixGenerator = mock(CodeFixGenerator.class);
        pullRequestCreator = mock(PullRequestCreator.class);
        notificationSender = mock(NotificationSender.class);
        ticketCreator = mock(TicketCreator.class);
        activityLog = mock(ActivityLogService.class);

        when(codeSearch.search(eq("api"), anyString(), anyInt()))
                .thenReturn(List.of(new CodeFile("src/api/Handler.java", "class Handler {}", "api-repo", 0.92)));
        when(fixGenerator.generate(any()))
                .thenReturn(new CodeFixResult("class Handler { /* fixed */ }", "Bound the retry loop", List.of()));
        when(pullRequestCreator.create(any()))
                .thenReturn(new PullRequestResult(42, "https://git.example.com/api/pull/42", "seer/fix-inc-1001"));
        when(notificationSender.send(any())).thenAnswer(invocation -> new NotificationReceipt("#incidents", clock.instant()));

        IncidentRecordRepository incidentRepository = InMemoryRepositories.incidents(incidents);
        registry = new IncidentRegistry(incidentRepository, new IncidentIdAllocator(incidentRepository),
                new KeyedLocks(), activityLog, mock(EventBroadcaster.class), clock);
    }

    private WorkflowOrchestrator orchestrator(Executor pipelineExecutor) {
        CollaboratorCalls calls = new CollaboratorCalls(Runnable::run);
        RemediationPipeline pipeline = new RemediationPipeline(List.of(
                new CodeSearchStep(codeSearch, calls, properties),
                new FixGenerationStep(fixGenerator, calls, properties),
                new PullRequestStep(pullRequestCreator, calls, properties),
                new NotifyTeamStep(notificationSender, calls, properties),
                new TicketStep(ticketCreator, calls, properties)), new SimpleMeterRegistry());
        return new WorkflowOrchestrator(registry,
                InMemoryRepositories.workflows(workflows),
                InMemoryRepositories.executions(executions),
                pipeline, activityLog, mock(EventBroadcaster.class), new KeyedLocks(),
                new SimpleMeterRegistry(), clock, pipelineExecutor);
    }

    private static AnomalyResult latencySpike() {
        return new AnomalyResult("p99_latency", 400, 200, 10.0, Severity.SEV_1, START,
                "api", "production", 20, 310);
    }

    private static List<StepStatus> statuses(WorkflowExecution execution) {
        return execution.getSteps().stream().map(WorkflowStepResult::status).toList();
    }

    @Test
    void anomalyOpensIncidentAwaitingApproval() {
        WorkflowOrchestrator orchestrator = orchestrator(Runnable::run);

        PendingWorkflow workflow = orchestrator.onAnomaly(latencySpike());

        IncidentRecord incident = registry.get(workflow.getIncidentId());
        assertThat(incident.getId()).isEqualTo("INC-1001");
        assertThat(incident.getStatus()).isEqualTo(IncidentStatus.AWAITING_APPROVAL);
        assertThat(incident.getSeverity()).isEqualTo(Severity.SEV_1);
        assertThat(incident.getSource()).isEqualTo("monitoring");
        assertThat(incident.getAnomaly()).isEqualTo(latencySpike());
        assertThat(workflow.getStatus()).isEqualTo(WorkflowApprovalStatus.PENDING_APPROVAL);
        assertThat(workflow.getActions())
                .containsExactly("code_search", "fix_generation", "pr_creation", "notify_team");
        assertThat(orchestrator.getPending()).containsExactly(workflow);
        assertThat(orchestrator.getAgentState(workflow.getId()).orElseThrow().status())
                .isEqualTo(ExecutionPhase.AWAITING_APPROVAL);
        verify(codeSearch, times(0)).search(anyString(), anyString(), anyInt());
    }

    @Test
    void approvedPipelineThatFullySucceedsResolvesIncident() {
        WorkflowOrchestrator orchestrator = orchestrator(Runnable::run);
        PendingWorkflow workflow = orchestrator.onAnomaly(latencySpike());
        clock.advance(Duration.ofMinutes(15));

        ApprovalOutcome outcome = orchestrator.respond(workflow.getId(), true, "looks right", "alice");
        WorkflowExecution execution = outcome.execution().join();

        assertThat(outcome.changed()).isTrue();
        assertThat(outcome.workflow().getRespondedBy()).isEqualTo("alice");
        assertThat(execution.getStatus()).isEqualTo(WorkflowExecution.ExecutionStatus.SUCCESS);
        assertThat(execution.summary().completed()).isEqualTo(4);
        assertThat(execution.getPrUrl()).isEqualTo("https://git.example.com/api/pull/42");

        IncidentRecord incident = registry.get(workflow.getIncidentId());
        assertThat(incident.getStatus()).isEqualTo(IncidentStatus.RESOLVED);
        assertThat(incident.getMttrSeconds()).isEqualTo(15 * 60.0);
        assertThat(incident.getRemediation().prNumber()).isEqualTo(42);
        assertThat(incident.getRemediation().filePath()).isEqualTo("src/api/Handler.java");
        assertThat(orchestrator.getAgentState(workflow.getId()).orElseThrow().status())
                .isEqualTo(ExecutionPhase.COMPLETED);
        assertThat(orchestrator.isPipelineActive(workflow.getIncidentId())).isFalse();
    }

    @Test
    void noFilesFoundSkipsFixAndPullRequestButStillNotifies() {
        when(codeSearch.search(eq("api"), anyString(), anyInt())).thenReturn(List.of());
        WorkflowOrchestrator orchestrator = orchestrator(Runnable::run);
        PendingWorkflow workflow = orchestrator.onAnomaly(latencySpike());

        WorkflowExecution execution = orchestrator.respond(workflow.getId(), true, null, "alice").execution().join();

        assertThat(statuses(execution)).containsExactly(
                StepStatus.COMPLETED, StepStatus.SKIPPED, StepStatus.SKIPPED, StepStatus.COMPLETED);
        assertThat(execution.getStatus()).isEqualTo(WorkflowExecution.ExecutionStatus.PARTIAL);
        IncidentRecord incident = registry.get(workflow.getIncidentId());
        assertThat(incident.getStatus()).isEqualTo(IncidentStatus.REMEDIATING);
        assertThat(incident.getRemediation()).isNull();
        verify(fixGenerator, times(0)).generate(any());
        verify(notificationSender).send(any());
    }

    @Test
    void failingPullRequestDoesNotAbortThePipeline() {
        when(pullRequestCreator.create(any())).thenThrow(new CollaboratorException("pull-request", "HTTP 502"));
        WorkflowOrchestrator orchestrator = orchestrator(Runnable::run);
        PendingWorkflow workflow = orchestrator.onAnomaly(latencySpike());

        WorkflowExecution execution = orchestrator.respond(workflow.getId(), true, null, "alice").execution().join();

        assertThat(statuses(execution)).containsExactly(
                StepStatus.COMPLETED, StepStatus.COMPLETED, StepStatus.FAILED, StepStatus.COMPLETED);
        assertThat(execution.getSteps().get(2).detail()).contains("HTTP 502");
        assertThat(execution.summary().failed()).isEqualTo(1);
        assertThat(registry.get(workflow.getIncidentId()).getStatus()).isEqualTo(IncidentStatus.REMEDIATING);
        assertThat(registry.get(workflow.getIncidentId()).getRemediation()).isNull();
    }

    @Test
    void shippedFixIsRecordedEvenWhenTicketFails() {
        properties.getPipeline().setTicketStepEnabled(true);
        when(ticketCreator.create(any())).thenThrow(new CollaboratorException("ticket", "tracker down"));
        WorkflowOrchestrator orchestrator = orchestrator(Runnable::run);
        PendingWorkflow workflow = orchestrator.onAnomaly(latencySpike());

        WorkflowExecution execution = orchestrator.respond(workflow.getId(), true, null, "alice").execution().join();

        assertThat(execution.summary().totalSteps()).isEqualTo(5);
        assertThat(statuses(execution)).endsWith(StepStatus.FAILED);
        IncidentRecord incident = registry.get(workflow.getIncidentId());
        assertThat(incident.getStatus()).isEqualTo(IncidentStatus.REMEDIATING);
        assertThat(incident.getRemediation().prUrl()).isEqualTo("https://git.example.com/api/pull/42");
    }

    @Test
    void unexpectedStepErrorIsRecordedAsFailure() {
        when(fixGenerator.generate(any())).thenThrow(new IllegalArgumentException("bad diff"));
        WorkflowOrchestrator orchestrator = orchestrator(Runnable::run);
        PendingWorkflow workflow = orchestrator.onAnomaly(latencySpike());

        WorkflowExecution execution = orchestrator.respond(workflow.getId(), true, null, "alice").execution().join();

        assertThat(statuses(execution)).containsExactly(
                StepStatus.COMPLETED, StepStatus.FAILED, StepStatus.SKIPPED, StepStatus.COMPLETED);
    }

    @Test
    void repeatedApprovalIsANoOp() {
        WorkflowOrchestrator orchestrator = orchestrator(Runnable::run);
        PendingWorkflow workflow = orchestrator.onAnomaly(latencySpike());
        orchestrator.respond(workflow.getId(), true, null, "alice");

        ApprovalOutcome again = orchestrator.respond(workflow.getId(), true, null, "bob");

        assertThat(again.changed()).isFalse();
        assertThat(again.pipelineStarted()).isFalse();
        assertThat(again.workflow().getRespondedBy()).isEqualTo("alice");
        assertThat(executions).hasSize(1);
    }

    @Test
    void rejectionSendsIncidentBackToAnalysis() {
        WorkflowOrchestrator orchestrator = orchestrator(Runnable::run);
        PendingWorkflow workflow = orchestrator.onAnomaly(latencySpike());

        ApprovalOutcome outcome = orchestrator.respond(workflow.getId(), false, "false positive", "alice");

        assertThat(outcome.workflow().getStatus()).isEqualTo(WorkflowApprovalStatus.REJECTED);
        assertThat(outcome.workflow().getRejectionReason()).isEqualTo("false positive");
        assertThat(outcome.pipelineStarted()).isFalse();
        assertThat(registry.get(workflow.getIncidentId()).getStatus()).isEqualTo(IncidentStatus.ANALYZING);
        assertThat(orchestrator.respond(workflow.getId(), false, null, "bob").changed()).isFalse();
        assertThat(executions).isEmpty();
        verify(activityLog).record(eq(ActivityType.WORKFLOW_REJECTED), eq("alice"), anyString(), anyMap());
    }

    @Test
    void contradictingAnAnswerIsRejected() {
        WorkflowOrchestrator orchestrator = orchestrator(Runnable::run);
        PendingWorkflow rejected = orchestrator.onAnomaly(latencySpike());
        PendingWorkflow approved = orchestrator.onAnomaly(latencySpike());
        orchestrator.respond(rejected.getId(), false, null, "alice");
        orchestrator.respond(approved.getId(), true, null, "alice");

        assertThatThrownBy(() -> orchestrator.respond(rejected.getId(), true, null, "bob"))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> orchestrator.respond(approved.getId(), false, null, "bob"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void onlyOnePipelinePerIncidentAtATime() {
        List<Runnable> queued = new ArrayList<>();
        WorkflowOrchestrator orchestrator = orchestrator(queued::add);
        PendingWorkflow workflow = orchestrator.onAnomaly(latencySpike());

        ApprovalOutcome outcome = orchestrator.respond(workflow.getId(), true, null, "alice");

        assertThat(orchestrator.isPipelineActive(workflow.getIncidentId())).isTrue();
        assertThatThrownBy(() -> orchestrator.rerun(workflow.getId(), "bob"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already running");

        queued.forEach(Runnable::run);
        assertThat(outcome.execution()).isCompleted();
        assertThat(orchestrator.isPipelineActive(workflow.getIncidentId())).isFalse();
    }

    @Test
    void rerunRequiresApprovedWorkflow() {
        WorkflowOrchestrator orchestrator = orchestrator(Runnable::run);
        PendingWorkflow workflow = orchestrator.onAnomaly(latencySpike());

        assertThatThrownBy(() -> orchestrator.rerun(workflow.getId(), "bob"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rerunAfterCollaboratorOutageCanResolve() {
        when(pullRequestCreator.create(any())).thenThrow(new CollaboratorException("pull-request", "HTTP 503"));
        WorkflowOrchestrator orchestrator = orchestrator(Runnable::run);
        PendingWorkflow workflow = orchestrator.onAnomaly(latencySpike());
        orchestrator.respond(workflow.getId(), true, null, "alice");

        doReturn(new PullRequestResult(43, "https://git.example.com/api/pull/43", "seer/fix-inc-1001"))
                .when(pullRequestCreator).create(any());
        WorkflowExecution second = orchestrator.rerun(workflow.getId(), "alice").join();

        assertThat(second.getStatus()).isEqualTo(WorkflowExecution.ExecutionStatus.SUCCESS);
        assertThat(registry.get(workflow.getIncidentId()).getStatus()).isEqualTo(IncidentStatus.RESOLVED);
        assertThat(orchestrator.getExecutions(workflow.getIncidentId())).hasSize(2);
    }

    @Test
    void everyStepOutcomeIsWrittenToTheActivityLog() {
        WorkflowOrchestrator orchestrator = orchestrator(Runnable::run);
        PendingWorkflow workflow = orchestrator.onAnomaly(latencySpike());

        orchestrator.respond(workflow.getId(), true, null, "alice");

        verify(activityLog, times(4)).record(eq(ActivityType.PIPELINE_STEP), eq("pipeline"), anyString(), anyMap(), any());
        verify(activityLog).record(eq(ActivityType.WORKFLOW_EXECUTED), eq("pipeline"), anyString(), anyMap(), any());
    }

    @Test
    void unknownWorkflowIsNotFound() {
        WorkflowOrchestrator orchestrator = orchestrator(Runnable::run);

        assertThatThrownBy(() -> orchestrator.respond("missing", true, null, "alice"))
                .isInstanceOf(WorkflowNotFoundException.class);
    }
}

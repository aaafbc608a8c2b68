package com.example.seer.workflow.step;

import com.example.seer.collaborator.FileChange;
import com.example.seer.collaborator.PullRequestCreator;
import com.example.seer.collaborator.PullRequestRequest;
import com.example.seer.collaborator.PullRequestResult;
import com.example.seer.config.SeerProperties;
import com.example.seer.domain.ExecutionPhase;
import com.example.seer.workflow.CollaboratorCalls;
import com.example.seer.workflow.PipelineContext;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

@Component
@Order(3)
@RequiredArgsConstructor
public class PullRequestStep implements PipelineStep {

    public static final String NAME = "pr_creation";

    private final PullRequestCreator pullRequestCreator;
    private final CollaboratorCalls calls;
    private final SeerProperties properties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ExecutionPhase phase() {
        return ExecutionPhase.REMEDIATING;
    }

    @Override
    public StepOutcome execute(PipelineContext context) {
        if (context.getFix() == null) {
            return StepOutcome.skipped("No generated fix to propose");
        }
        String incidentId = context.incidentId();
        PullRequestRequest request = new PullRequestRequest(
                "[" + incidentId + "] " + context.getIncident().getTitle(),
                context.getFix().explanation(),
                branchFor(incidentId),
                List.of(new FileChange(context.getTargetFile().filePath(), context.getFix().fixedCode())),
                incidentId);

        PullRequestResult pullRequest = calls.call(NAME,
                Duration.ofSeconds(properties.getPipeline().getPullRequestTimeoutSeconds()),
                () -> pullRequestCreator.create(request));
        context.setPullRequest(pullRequest);
        return StepOutcome.completed("Opened " + pullRequest.prUrl());
    }

    static String branchFor(String incidentId) {
        return "seer/fix-" + incidentId.toLowerCase(Locale.ROOT);
    }
}

package com.example.seer.workflow.step;

import com.example.seer.collaborator.NotificationReceipt;
import com.example.seer.collaborator.NotificationRequest;
import com.example.seer.collaborator.NotificationSender;
import com.example.seer.config.SeerProperties;
import com.example.seer.domain.ExecutionPhase;
import com.example.seer.domain.IncidentRecord;
import com.example.seer.workflow.CollaboratorCalls;
import com.example.seer.workflow.PipelineContext;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Tells the team what the pipeline did. Runs whether or not a fix was
 * produced: without a pull request the message asks for manual follow-up.
 */
@Component
@Order(4)
@RequiredArgsConstructor
public class NotifyTeamStep implements PipelineStep {

    public static final String NAME = "notify_team";

    private final NotificationSender notificationSender;
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
        IncidentRecord incident = context.getIncident();
        String message = context.getPullRequest() != null
                ? "Automated fix proposed in " + context.getPullRequest().prUrl() + ", please review."
                : "No automated fix could be shipped; manual investigation needed.";

        NotificationRequest request = new NotificationRequest(
                incident.getSeverity(), incident.getId(), incident.getTitle(), message, true);
        NotificationReceipt receipt = calls.call(NAME,
                Duration.ofSeconds(properties.getPipeline().getNotificationTimeoutSeconds()),
                () -> notificationSender.send(request));
        context.setNotification(receipt);
        return StepOutcome.completed("Notified " + receipt.channel());
    }
}

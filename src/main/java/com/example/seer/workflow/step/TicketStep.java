package com.example.seer.workflow.step;

import com.example.seer.collaborator.TicketCreator;
import com.example.seer.collaborator.TicketRequest;
import com.example.seer.collaborator.TicketResult;
import com.example.seer.config.SeerProperties;
import com.example.seer.domain.ExecutionPhase;
import com.example.seer.domain.IncidentRecord;
import com.example.seer.domain.Severity;
import com.example.seer.workflow.CollaboratorCalls;
import com.example.seer.workflow.PipelineContext;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Files a follow-up ticket. Only part of the pipeline when
 * {@code seer.pipeline.ticket-step-enabled} is set.
 */
@Component
@Order(5)
@RequiredArgsConstructor
public class TicketStep implements PipelineStep {

    public static final String NAME = "ticket_creation";

    private final TicketCreator ticketCreator;
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
    public boolean isEnabled() {
        return properties.getPipeline().isTicketStepEnabled();
    }

    @Override
    public StepOutcome execute(PipelineContext context) {
        IncidentRecord incident = context.getIncident();
        String description = incident.getDescription();
        if (context.getPullRequest() != null) {
            description = description + "\n\nProposed fix: " + context.getPullRequest().prUrl();
        }
        TicketRequest request = new TicketRequest(
                "[" + incident.getId() + "] " + incident.getTitle(),
                description,
                priorityFor(incident.getSeverity()),
                incident.getId());

        TicketResult ticket = calls.call(NAME,
                Duration.ofSeconds(properties.getPipeline().getTicketTimeoutSeconds()),
                () -> ticketCreator.create(request));
        context.setTicket(ticket);
        return StepOutcome.completed("Created ticket " + ticket.ticketId());
    }

    static String priorityFor(Severity severity) {
        return switch (severity) {
            case SEV_1 -> "Highest";
            case SEV_2 -> "High";
            case SEV_3 -> "Medium";
        };
    }
}

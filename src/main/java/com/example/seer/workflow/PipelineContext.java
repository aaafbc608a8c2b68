package com.example.seer.workflow;

import com.example.seer.collaborator.CodeFile;
import com.example.seer.collaborator.CodeFixResult;
import com.example.seer.collaborator.NotificationReceipt;
import com.example.seer.collaborator.PullRequestResult;
import com.example.seer.collaborator.TicketResult;
import com.example.seer.domain.AnomalyResult;
import com.example.seer.domain.IncidentRecord;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * State handed from one pipeline step to the next during a single run.
 * A field left null means the step that produces it did not succeed.
 */
@Getter
@Setter
public class PipelineContext {

    private final IncidentRecord incident;
    private final AnomalyResult anomaly;

    private List<CodeFile> relevantFiles = new ArrayList<>();
    private CodeFile targetFile;
    private CodeFixResult fix;
    private PullRequestResult pullRequest;
    private NotificationReceipt notification;
    private TicketResult ticket;

    public PipelineContext(IncidentRecord incident, AnomalyResult anomaly) {
        this.incident = incident;
        this.anomaly = anomaly;
    }

    public String incidentId() {
        return incident.getId();
    }

    public boolean hasShippedFix() {
        return fix != null && pullRequest != null;
    }
}

package com.example.seer.workflow.step;

import com.example.seer.collaborator.CodeFile;
import com.example.seer.collaborator.CodeSearchClient;
import com.example.seer.config.SeerProperties;
import com.example.seer.domain.ExecutionPhase;
import com.example.seer.workflow.CollaboratorCalls;
import com.example.seer.workflow.PipelineContext;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

@Component
@Order(1)
@RequiredArgsConstructor
public class CodeSearchStep implements PipelineStep {

    public static final String NAME = "code_search";

    private final CodeSearchClient codeSearch;
    private final CollaboratorCalls calls;
    private final SeerProperties properties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ExecutionPhase phase() {
        return ExecutionPhase.RESEARCHING;
    }

    @Override
    public StepOutcome execute(PipelineContext context) {
        SeerProperties.PipelineConfig config = properties.getPipeline();
        String service = context.getIncident().getService();
        String query = context.getAnomaly() != null
                ? context.getAnomaly().metric() + " " + service
                : context.getIncident().getTitle();

        List<CodeFile> files = calls.call(NAME, Duration.ofSeconds(config.getCodeSearchTimeoutSeconds()),
                () -> codeSearch.search(service, query, config.getCodeSearchLimit()));
        context.setRelevantFiles(files);
        if (files.isEmpty()) {
            return StepOutcome.completed("No relevant files found for " + service);
        }
        return StepOutcome.completed("Found " + files.size() + " relevant file(s), top match " + files.get(0).filePath());
    }
}

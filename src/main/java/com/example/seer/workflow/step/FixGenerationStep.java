package com.example.seer.workflow.step;

import com.example.seer.collaborator.CodeFile;
import com.example.seer.collaborator.CodeFixGenerator;
import com.example.seer.collaborator.CodeFixRequest;
import com.example.seer.collaborator.CodeFixResult;
import com.example.seer.config.SeerProperties;
import com.example.seer.domain.AnomalyResult;
import com.example.seer.domain.Diagnosis;
import com.example.seer.domain.ExecutionPhase;
import com.example.seer.domain.IncidentRecord;
import com.example.seer.workflow.CollaboratorCalls;
import com.example.seer.workflow.PipelineContext;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Asks the fix generator for a corrected version of the best-matching file.
 */
@Component
@Order(2)
@RequiredArgsConstructor
public class FixGenerationStep implements PipelineStep {

    public static final String NAME = "fix_generation";

    private final CodeFixGenerator fixGenerator;
    private final CollaboratorCalls calls;
    private final SeerProperties properties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ExecutionPhase phase() {
        return ExecutionPhase.DIAGNOSING;
    }

    @Override
    public StepOutcome execute(PipelineContext context) {
        if (context.getRelevantFiles().isEmpty()) {
            return StepOutcome.skipped("No source files to fix");
        }
        CodeFile target = context.getRelevantFiles().get(0);
        CodeFixRequest request = new CodeFixRequest(
                target.filePath(),
                describeProblem(context.getIncident()),
                target.content(),
                describeAnomaly(context.getAnomaly()));

        CodeFixResult fix = calls.call(NAME,
                Duration.ofSeconds(properties.getPipeline().getFixGenerationTimeoutSeconds()),
                () -> fixGenerator.generate(request));
        context.setTargetFile(target);
        context.setFix(fix);
        return StepOutcome.completed("Generated fix for " + target.filePath());
    }

    private static String describeProblem(IncidentRecord incident) {
        Diagnosis diagnosis = incident.getDiagnosis();
        if (diagnosis == null || Diagnosis.UNDER_INVESTIGATION.equals(diagnosis.rootCause())) {
            return incident.getTitle() + ": " + incident.getDescription();
        }
        return diagnosis.rootCause();
    }

    private static String describeAnomaly(AnomalyResult anomaly) {
        if (anomaly == null) {
            return "";
        }
        String deviation = anomaly.isUnbounded()
                ? "above a zero-variance baseline"
                : String.format("%.1f sigma from baseline", anomaly.deviationSigma());
        return String.format("%s on %s observed %.2f against expected %.2f (%s, %s)",
                anomaly.metric(), anomaly.service(), anomaly.currentValue(), anomaly.expectedValue(),
                deviation, anomaly.severity().getLabel());
    }
}

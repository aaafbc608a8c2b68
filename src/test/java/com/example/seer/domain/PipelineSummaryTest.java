package com.example.seer.domain;

import com.example.seer.exception.ConsistencyViolationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineSummaryTest {

    @Test
    void countsEachOutcome() {
        PipelineSummary summary = PipelineSummary.of(List.of(
                WorkflowStepResult.completed(1, "code_search", "3 files"),
                WorkflowStepResult.completed(2, "fix_generation", "ok"),
                WorkflowStepResult.failed(3, "pr_creation", "HTTP 500"),
                WorkflowStepResult.completed(4, "notify_team", "sent")));

        assertEquals(4, summary.totalSteps());
        assertEquals(3, summary.completed());
        assertEquals(1, summary.failed());
        assertEquals(0, summary.skipped());
        assertFalse(summary.allCompleted());
    }

    @Test
    void outcomesMustAddUpToTotal() {
        assertThrows(ConsistencyViolationException.class, () -> new PipelineSummary(4, 2, 1, 0));
    }

    @Test
    void emptyRunIsNotAllCompleted() {
        assertFalse(PipelineSummary.of(List.of()).allCompleted());
        assertTrue(new PipelineSummary(2, 2, 0, 0).allCompleted());
    }
}

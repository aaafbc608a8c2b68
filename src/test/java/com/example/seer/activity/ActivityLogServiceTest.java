package com.example.seer.activity;

import com.example.seer.domain.ActivityLogEntry;
import com.example.seer.domain.ActivityType;
import com.example.seer.repository.ActivityLogRepository;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ActivityLogServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final ActivityLogRepository repository = mock(ActivityLogRepository.class);
    private final ActivityLogService service = new ActivityLogService(repository, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void recordsEntryWithDefaults() {
        service.record(ActivityType.INCIDENT_REGISTERED, null, "INC-1001 registered", null);

        ArgumentCaptor<ActivityLogEntry> captor = ArgumentCaptor.forClass(ActivityLogEntry.class);
        verify(repository).save(captor.capture());
        ActivityLogEntry entry = captor.getValue();
        assertThat(entry.getUser()).isEqualTo("system");
        assertThat(entry.getTimestamp()).isEqualTo(NOW);
        assertThat(entry.getDetails()).isEmpty();
        assertThat(entry.getStatus()).isEqualTo(ActivityLogEntry.Outcome.SUCCESS);
    }

    @Test
    void storeFailureDoesNotPropagate() {
        when(repository.save(any())).thenThrow(new IllegalStateException("disk full"));

        assertThatCode(() -> service.record(ActivityType.PIPELINE_STEP, "orchestrator", "step failed",
                Map.of("step", "pr_creation"), ActivityLogEntry.Outcome.FAILED))
                .doesNotThrowAnyException();
    }

    @Test
    void listsAllWhenNoTypeGiven() {
        service.list(null);
        verify(repository).findAllByOrderByTimestampAsc();

        service.list(ActivityType.WORKFLOW_APPROVED);
        verify(repository).findByTypeOrderByTimestampAsc(ActivityType.WORKFLOW_APPROVED);
    }
}

package com.example.seer.activity;

import com.example.seer.domain.ActivityLogEntry;
import com.example.seer.domain.ActivityType;
import com.example.seer.repository.ActivityLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Append-only audit sink. Every incident transition and every pipeline step
 * outcome is recorded here; dashboards read the table directly.
 *
 * <p>Writes are synchronous so entries keep the order of the events they
 * describe. A failed write is logged and never propagates into the workflow
 * that produced it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActivityLogService {

    private final ActivityLogRepository activityLogRepository;
    private final Clock clock;

    public void record(ActivityType type, String user, String summary, Map<String, Object> details) {
        record(type, user, summary, details, ActivityLogEntry.Outcome.SUCCESS);
    }

    public void record(ActivityType type, String user, String summary, Map<String, Object> details,
                       ActivityLogEntry.Outcome status) {
        try {
            ActivityLogEntry entry = ActivityLogEntry.builder()
                    .timestamp(clock.instant())
                    .type(type)
                    .user(user != null ? user : "system")
                    .summary(summary)
                    .details(details != null ? details : Map.of())
                    .status(status)
                    .build();
            activityLogRepository.save(entry);
            log.debug("Activity: [{}] {} - {} ({})", entry.getUser(), type, summary, status);
        } catch (Exception e) {
            log.error("Failed to write activity log entry {} '{}': {}", type, summary, e.getMessage());
        }
    }

    /** Entries in the order they were written, optionally of one type only. */
    public List<ActivityLogEntry> list(ActivityType type) {
        return type != null
                ? activityLogRepository.findByTypeOrderByTimestampAsc(type)
                : activityLogRepository.findAllByOrderByTimestampAsc();
    }
}

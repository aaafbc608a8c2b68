package com.example.seer.repository;

import com.example.seer.domain.ActivityLogEntry;
import com.example.seer.domain.ActivityType;
import org.springframework.data.repository.Repository;

import java.util.List;

/**
 * Append-only: only save and read methods are exposed, no update or delete.
 */
@org.springframework.stereotype.Repository
public interface ActivityLogRepository extends Repository<ActivityLogEntry, String> {

    ActivityLogEntry save(ActivityLogEntry entry);

    List<ActivityLogEntry> findAllByOrderByTimestampAsc();

    List<ActivityLogEntry> findByTypeOrderByTimestampAsc(ActivityType type);

    long count();
}

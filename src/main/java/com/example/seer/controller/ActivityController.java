package com.example.seer.controller;

import com.example.seer.activity.ActivityLogService;
import com.example.seer.domain.ActivityLogEntry;
import com.example.seer.domain.ActivityType;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;

/**
 * Read-only view of the activity log.
 */
@RestController
@RequestMapping("/api/activity")
@RequiredArgsConstructor
public class ActivityController {

    private final ActivityLogService activityLogService;

    @GetMapping
    public ResponseEntity<List<ActivityLogEntry>> list(@RequestParam(required = false) String type) {
        ActivityType filter = type != null ? ActivityType.valueOf(type.trim().toUpperCase(Locale.ROOT)) : null;
        return ResponseEntity.ok(activityLogService.list(filter));
    }
}

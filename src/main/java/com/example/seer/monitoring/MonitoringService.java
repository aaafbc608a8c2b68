package com.example.seer.monitoring;

import com.example.seer.activity.ActivityLogService;
import com.example.seer.config.SeerProperties;
import com.example.seer.detection.AnomalyDetector;
import com.example.seer.detection.BaselineCalculator;
import com.example.seer.detection.DetectionOutcome;
import com.example.seer.domain.ActivityType;
import com.example.seer.domain.AnomalyResult;
import com.example.seer.domain.PendingWorkflow;
import com.example.seer.gateway.EventBroadcaster;
import com.example.seer.metrics.MetricsRepository;
import com.example.seer.metrics.SeriesKey;
import com.example.seer.workflow.WorkflowOrchestrator;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * Monitoring loop: every interval it evaluates each active series against
 * its baseline and opens a remediation workflow for new anomalies.
 *
 * <p>Iterations run with a fixed delay on a single-threaded scheduler, so
 * they never overlap. {@link #stop()} lets the current iteration finish.
 * One failing series is logged and skipped without affecting the others.
 * A series that just opened a workflow is not acted on again until its
 * cooldown has passed.
 */
@Slf4j
@Service
public class MonitoringService {

    private final MetricsRepository metricsRepository;
    private final BaselineCalculator baselineCalculator;
    private final AnomalyDetector anomalyDetector;
    private final WorkflowOrchestrator orchestrator;
    private final ActivityLogService activityLog;
    private final EventBroadcaster events;
    private final SeerProperties properties;
    private final MeterRegistry meterRegistry;
    private final TaskScheduler scheduler;
    private final Clock clock;

    private final Cache<String, Instant> cooldowns;
    private final Deque<AnomalyResult> recentAnomalies = new ArrayDeque<>();

    private volatile boolean running;
    private volatile Instant lastCheck;
    private ScheduledFuture<?> scheduledTask;

    public MonitoringService(MetricsRepository metricsRepository,
                             BaselineCalculator baselineCalculator,
                             AnomalyDetector anomalyDetector,
                             WorkflowOrchestrator orchestrator,
                             ActivityLogService activityLog,
                             EventBroadcaster events,
                             SeerProperties properties,
                             MeterRegistry meterRegistry,
                             @Qualifier("monitoringScheduler") TaskScheduler scheduler,
                             Clock clock) {
        this.metricsRepository = metricsRepository;
        this.baselineCalculator = baselineCalculator;
        this.anomalyDetector = anomalyDetector;
        this.orchestrator = orchestrator;
        this.activityLog = activityLog;
        this.events = events;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.scheduler = scheduler;
        this.clock = clock;
        this.cooldowns = Caffeine.newBuilder()
                .expireAfterWrite(cooldown())
                .maximumSize(Math.max(1, properties.getDetection().getMaxTrackedSeries()) * 10L)
                .build();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void autoStart() {
        if (properties.getMonitoring().isAutoStart()) {
            start();
        }
    }

    /**
     * Start the loop. Returns false when it was already running.
     */
    public synchronized boolean start() {
        if (running) {
            return false;
        }
        running = true;
        Duration interval = Duration.ofSeconds(properties.getMonitoring().getCheckIntervalSeconds());
        scheduledTask = scheduler.scheduleWithFixedDelay(this::tick, interval);
        log.info("Monitoring started (interval {}s, threshold {}σ)",
                interval.toSeconds(), properties.getDetection().getSigmaThreshold());
        events.broadcast("monitoring.started", Map.of("check_interval_seconds", interval.toSeconds()));
        return true;
    }

    /**
     * Stop the loop at the next iteration boundary. Returns false when it was not running.
     */
    public synchronized boolean stop() {
        if (!running) {
            return false;
        }
        running = false;
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
            scheduledTask = null;
        }
        log.info("Monitoring stopped");
        events.broadcast("monitoring.stopped", Map.of());
        return true;
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public MonitoringStatus getStatus() {
        List<AnomalyResult> recent;
        synchronized (recentAnomalies) {
            recent = new ArrayList<>(recentAnomalies);
        }
        List<PendingWorkflow> pending = orchestrator.getPending();
        return new MonitoringStatus(running, lastCheck,
                properties.getMonitoring().getCheckIntervalSeconds(),
                properties.getDetection().getSigmaThreshold(),
                recent, pending);
    }

    private void tick() {
        if (!running) {
            return;
        }
        try {
            runIteration(clock.instant());
        } catch (Exception e) {
            log.error("Monitoring iteration failed", e);
        }
    }

    /**
     * One pass over every series active in the baseline window, evaluated at {@code now}.
     */
    public IterationReport runIteration(Instant now) {
        Timer.Sample sample = Timer.start(meterRegistry);
        List<SeriesKey> series = metricsRepository.listSeries(
                baselineCalculator.baselineWindow(now), properties.getDetection().getMaxTrackedSeries());
        String environment = properties.getMonitoring().getEnvironment();

        List<AnomalyResult> anomalies = new ArrayList<>();
        List<String> workflowsOpened = new ArrayList<>();
        int insufficient = 0;
        int suppressed = 0;
        int errors = 0;

        for (SeriesKey key : series) {
            try {
                DetectionOutcome outcome = anomalyDetector.detect(key.service(), key.metric(), environment, now);
                if (outcome.kind() == DetectionOutcome.Kind.INSUFFICIENT_DATA) {
                    insufficient++;
                    continue;
                }
                if (!outcome.isAnomaly()) {
                    continue;
                }
                AnomalyResult anomaly = outcome.anomaly();
                anomalies.add(anomaly);
                if (isCoolingDown(anomaly.seriesKey(), now)) {
                    log.debug("Anomaly on {} suppressed, series is cooling down", anomaly.seriesKey());
                    suppressed++;
                    continue;
                }
                PendingWorkflow workflow = handleAnomaly(anomaly, now);
                workflowsOpened.add(workflow.getId());
            } catch (Exception e) {
                errors++;
                log.error("Failed to evaluate {}/{}: {}", key.service(), key.metric(), e.getMessage(), e);
            }
        }

        lastCheck = now;
        sample.stop(meterRegistry.timer("seer.monitoring.iteration"));
        if (!anomalies.isEmpty() || errors > 0) {
            log.info("Monitoring iteration: {} series, {} anomalies, {} workflows opened, {} suppressed, {} errors",
                    series.size(), anomalies.size(), workflowsOpened.size(), suppressed, errors);
        } else {
            log.debug("Monitoring iteration: {} series checked, no anomalies", series.size());
        }
        return new IterationReport(now, series.size(), insufficient, anomalies, workflowsOpened, suppressed, errors);
    }

    private PendingWorkflow handleAnomaly(AnomalyResult anomaly, Instant now) {
        Counter.builder("seer.anomalies.detected")
                .tag("service", anomaly.service())
                .tag("severity", anomaly.severity().getLabel())
                .register(meterRegistry)
                .increment();
        rememberAnomaly(anomaly);

        Map<String, Object> details = new HashMap<>();
        details.put("service", anomaly.service());
        details.put("metric", anomaly.metric());
        details.put("current_value", anomaly.currentValue());
        details.put("expected_value", anomaly.expectedValue());
        details.put("deviation_sigma", anomaly.isUnbounded() ? "unbounded" : anomaly.deviationSigma());
        details.put("severity", anomaly.severity().getLabel());
        activityLog.record(ActivityType.ANOMALY_DETECTED, "monitoring",
                anomaly.severity().getLabel() + " anomaly on " + anomaly.seriesKey(), details);
        events.broadcast("anomaly.detected", details);

        PendingWorkflow workflow = orchestrator.onAnomaly(anomaly);
        cooldowns.put(anomaly.seriesKey(), now);
        return workflow;
    }

    private boolean isCoolingDown(String seriesKey, Instant now) {
        Instant lastOpened = cooldowns.getIfPresent(seriesKey);
        return lastOpened != null && now.isBefore(lastOpened.plus(cooldown()));
    }

    private void rememberAnomaly(AnomalyResult anomaly) {
        int limit = Math.max(1, properties.getMonitoring().getRecentAnomalyLimit());
        synchronized (recentAnomalies) {
            recentAnomalies.addFirst(anomaly);
            while (recentAnomalies.size() > limit) {
                recentAnomalies.removeLast();
            }
        }
    }

    private Duration cooldown() {
        return Duration.ofMinutes(properties.getMonitoring().getCooldownMinutes());
    }
}

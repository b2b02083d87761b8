package com.marketdesk.jobs.service;

import com.marketdesk.jobs.domain.ListingAction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Service for tracking job, task and reconciliation metrics.
 * Exposes metrics via Spring Boot Actuator for monitoring.
 */
@Service
@Slf4j
public class JobMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter tasksEnqueuedCounter;
    private final Counter tasksCompletedCounter;
    private final Counter tasksFailedCounter;
    private final Counter tasksReapedCounter;
    private final Map<ListingAction, Counter> reconciliationCounters = new EnumMap<>(ListingAction.class);
    private final Counter reconciliationFailuresCounter;

    public JobMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.tasksEnqueuedCounter = Counter.builder("jobs.tasks.enqueued")
                .description("Total number of tasks pushed to the work queue")
                .register(meterRegistry);

        this.tasksCompletedCounter = Counter.builder("jobs.tasks.completed")
                .description("Total number of tasks completed by in-process workers")
                .register(meterRegistry);

        this.tasksFailedCounter = Counter.builder("jobs.tasks.failed")
                .description("Total number of tasks failed by in-process workers")
                .register(meterRegistry);

        this.tasksReapedCounter = Counter.builder("jobs.tasks.reaped")
                .description("Total number of running tasks failed after their lease expired")
                .register(meterRegistry);

        for (ListingAction action : ListingAction.values()) {
            reconciliationCounters.put(action, Counter.builder("jobs.reconciliation.actions")
                    .description("Securities reconciliation actions applied")
                    .tag("action", action.name().toLowerCase())
                    .register(meterRegistry));
        }

        this.reconciliationFailuresCounter = Counter.builder("jobs.reconciliation.failures")
                .description("Per-record reconciliation failures")
                .register(meterRegistry);

        log.info("JobMetricsService initialized with Micrometer metrics");
    }

    /**
     * Record a finished job invocation.
     */
    public void recordJobRun(String jobName, boolean success, Duration duration) {
        Counter.builder("jobs.scheduled.runs")
                .description("Scheduled job invocations")
                .tag("job", jobName)
                .tag("outcome", success ? "success" : "failure")
                .register(meterRegistry)
                .increment();
        Timer.builder("jobs.scheduled.duration")
                .description("Scheduled job execution time")
                .tag("job", jobName)
                .register(meterRegistry)
                .record(duration);
    }

    public void recordTaskEnqueued() {
        tasksEnqueuedCounter.increment();
    }

    public void recordTaskCompleted() {
        tasksCompletedCounter.increment();
    }

    public void recordTaskFailed() {
        tasksFailedCounter.increment();
    }

    public void recordTaskReaped() {
        tasksReapedCounter.increment();
    }

    public void recordReconciliationAction(ListingAction action) {
        reconciliationCounters.get(action).increment();
    }

    public void recordReconciliationFailure() {
        reconciliationFailuresCounter.increment();
    }

    /**
     * Get current metrics summary (for logging purposes).
     */
    public String getMetricsSummary() {
        return String.format("Metrics: Enqueued=%d, Completed=%d, Failed=%d, Reaped=%d",
                (long) tasksEnqueuedCounter.count(),
                (long) tasksCompletedCounter.count(),
                (long) tasksFailedCounter.count(),
                (long) tasksReapedCounter.count());
    }
}

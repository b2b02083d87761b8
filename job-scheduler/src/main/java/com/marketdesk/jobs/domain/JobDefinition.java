package com.marketdesk.jobs.domain;

import com.marketdesk.jobs.exception.JobConfigurationException;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A named unit of scheduled work and its run bookkeeping.
 * Configuration is immutable; running flag and timestamps are updated by the runner.
 */
@Getter
public class JobDefinition {

    private final String name;
    private final List<LocalTime> schedule;
    private final boolean skipOnWeekends;
    private final boolean runOnInit;
    private final JobFunction function;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Instant lastRun;
    private volatile Instant lastCompletion;

    @Builder
    public JobDefinition(String name, @Singular("at") List<LocalTime> schedule, boolean skipOnWeekends,
            boolean runOnInit, JobFunction function) {
        if (name == null || name.isBlank()) {
            throw new JobConfigurationException("Job name must not be blank");
        }
        if (schedule == null || schedule.isEmpty()) {
            throw new JobConfigurationException("Job " + name + " has no schedule times");
        }
        if (function == null) {
            throw new JobConfigurationException("Job " + name + " has no function");
        }
        this.name = name;
        this.schedule = schedule.stream().sorted().distinct().toList();
        this.skipOnWeekends = skipOnWeekends;
        this.runOnInit = runOnInit;
        this.function = function;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Claim the job for one run.
     *
     * @return false if the job is already running
     */
    public boolean tryStart() {
        return running.compareAndSet(false, true);
    }

    public void finish() {
        running.set(false);
    }

    public void recordRun(Instant at) {
        this.lastRun = at;
    }

    public void recordCompletion(Instant at) {
        this.lastCompletion = at;
    }
}

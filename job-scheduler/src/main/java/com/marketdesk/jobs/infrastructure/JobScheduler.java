package com.marketdesk.jobs.infrastructure;

import com.marketdesk.jobs.config.JobsProperties;
import com.marketdesk.jobs.domain.BoundaryTracker;
import com.marketdesk.jobs.domain.JobDefinition;
import com.marketdesk.jobs.domain.MarketBoundary;
import com.marketdesk.jobs.domain.QueueEnvelope;
import com.marketdesk.jobs.exception.TaskQueueException;
import com.marketdesk.jobs.service.JobRegistry;
import com.marketdesk.jobs.service.JobRunner;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Daily event loop that fires jobs at the market open and close boundaries.
 * Jobs of a boundary run one after another on the loop thread.
 * Each instance owns its own boundary state.
 */
@Slf4j
public class JobScheduler {

    private static final int QUEUE_STATUS_PREVIEW = 5;

    private final JobRegistry jobRegistry;
    private final JobRunner jobRunner;
    private final TaskQueue taskQueue;
    private final JobStatusStore statusStore;
    private final List<BackgroundService> backgroundServices;
    private final ScheduledExecutorService executor;
    private final Clock clock;
    private final JobsProperties.Scheduler settings;
    private final BoundaryTracker boundaries;

    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final AtomicLong tickCount = new AtomicLong();
    private boolean initialized;
    private boolean stopped;
    private ScheduledFuture<?> tickHandle;

    public JobScheduler(JobRegistry jobRegistry, JobRunner jobRunner, TaskQueue taskQueue,
            JobStatusStore statusStore, List<BackgroundService> backgroundServices,
            ScheduledExecutorService executor, Clock clock, JobsProperties.Scheduler settings) {
        this.jobRegistry = jobRegistry;
        this.jobRunner = jobRunner;
        this.taskQueue = taskQueue;
        this.statusStore = statusStore;
        this.backgroundServices = backgroundServices;
        this.executor = executor;
        this.clock = clock;
        this.settings = settings;
        this.boundaries = new BoundaryTracker(settings.getOpenTime(), settings.getCloseTime());
    }

    /**
     * Load job status, start background services, queue the run-on-init jobs and begin ticking.
     * Runs once no matter how many callers race into it.
     */
    public void start() {
        lifecycleLock.lock();
        try {
            if (initialized) {
                log.debug("Scheduler already initialized");
                return;
            }
            initialized = true;

            jobRegistry.loadStatus(statusStore);
            for (BackgroundService service : backgroundServices) {
                try {
                    service.start();
                    log.info("Started background service {}", service.getName());
                } catch (RuntimeException e) {
                    log.error("Background service {} failed to start: {}", service.getName(), e.getMessage(), e);
                }
            }

            executor.execute(this::runInitJobs);
            Duration interval = settings.getTickInterval();
            tickHandle = executor.scheduleWithFixedDelay(this::safeTick, 0, interval.toMillis(),
                    TimeUnit.MILLISECONDS);

            log.info("Scheduler started: {} jobs, open {} close {} ({}), tick every {}",
                    jobRegistry.size(), settings.getOpenTime(), settings.getCloseTime(), clock.getZone(), interval);
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Cancel future ticks without interrupting a running job, and stop background services.
     */
    public void stop() {
        lifecycleLock.lock();
        try {
            if (!initialized || stopped) {
                return;
            }
            stopped = true;
            if (tickHandle != null) {
                tickHandle.cancel(false);
            }
            for (BackgroundService service : backgroundServices) {
                try {
                    service.stop();
                } catch (RuntimeException e) {
                    log.warn("Background service {} failed to stop: {}", service.getName(), e.getMessage());
                }
            }
            log.info("Scheduler stopped after {} ticks", tickCount.get());
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Evaluate the boundaries at the given time and run the jobs of a boundary that fires.
     *
     * @return the boundary that fired, if any
     */
    public Optional<MarketBoundary> tick(ZonedDateTime now) {
        long tick = tickCount.incrementAndGet();
        Optional<MarketBoundary> fired = boundaries.evaluate(now.toLocalTime());
        fired.ifPresent(boundary -> fire(boundary, now));

        if (settings.getQueueStatusEveryTicks() > 0 && tick % settings.getQueueStatusEveryTicks() == 0) {
            logQueueStatus();
        }
        return fired;
    }

    /**
     * Jobs attached to a boundary, in schedule order counted from the boundary time.
     */
    public List<JobDefinition> jobsFor(MarketBoundary boundary) {
        LocalTime start = boundary == MarketBoundary.OPEN ? boundaries.getOpenTime() : boundaries.getCloseTime();
        return jobRegistry.list().stream()
                .filter(job -> job.getSchedule().stream().anyMatch(t -> boundaries.boundaryFor(t) == boundary))
                .sorted(Comparator.comparing((JobDefinition job) -> offsetAfter(job, boundary, start))
                        .thenComparing(JobDefinition::getName))
                .toList();
    }

    public long getTickCount() {
        return tickCount.get();
    }

    private void fire(MarketBoundary boundary, ZonedDateTime now) {
        boolean weekend = now.getDayOfWeek() == DayOfWeek.SATURDAY || now.getDayOfWeek() == DayOfWeek.SUNDAY;
        List<JobDefinition> jobs = jobsFor(boundary);
        log.info("{} boundary fired at {}; {} jobs", boundary, now, jobs.size());

        for (JobDefinition job : jobs) {
            if (weekend && job.isSkipOnWeekends()) {
                log.info("Skipping {} on {}", job.getName(), now.getDayOfWeek());
                continue;
            }
            jobRunner.run(job, boundary.name());
        }
    }

    private void runInitJobs() {
        for (JobDefinition job : jobRegistry.list()) {
            if (job.isRunOnInit()) {
                jobRunner.run(job, "init");
            }
        }
    }

    private void safeTick() {
        try {
            tick(ZonedDateTime.now(clock));
        } catch (RuntimeException e) {
            // An escaping exception would cancel all future ticks
            log.error("Scheduler tick failed: {}", e.getMessage(), e);
        }
    }

    private void logQueueStatus() {
        try {
            long depth = taskQueue.depth();
            List<QueueEnvelope> pending = taskQueue.pending(QUEUE_STATUS_PREVIEW);
            log.info("Queue status: {} pending", depth);
            for (QueueEnvelope envelope : pending) {
                log.info("  {} {} {}", envelope.getId(), envelope.getFunc(), envelope.getArgs());
            }
        } catch (TaskQueueException e) {
            log.warn("Could not read queue status: {}", e.getMessage());
        }
    }

    private Duration offsetAfter(JobDefinition job, MarketBoundary boundary, LocalTime start) {
        return job.getSchedule().stream()
                .filter(time -> boundaries.boundaryFor(time) == boundary)
                .map(time -> {
                    Duration offset = Duration.between(start, time);
                    return offset.isNegative() ? offset.plusDays(1) : offset;
                })
                .min(Comparator.naturalOrder())
                .orElse(Duration.ZERO);
    }
}

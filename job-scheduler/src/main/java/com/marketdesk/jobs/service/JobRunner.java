package com.marketdesk.jobs.service;

import com.marketdesk.jobs.domain.JobDefinition;
import com.marketdesk.jobs.domain.JobExecution;
import com.marketdesk.jobs.infrastructure.JobStatusStore;
import com.marketdesk.jobs.infrastructure.TaskQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Invokes a job with run bookkeeping: re-entrancy guard, timestamps, metrics and logging.
 * Job failures are reported in the returned execution, never thrown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobRunner {

    private final TaskQueue taskQueue;
    private final TaskMonitor taskMonitor;
    private final JobStatusStore statusStore;
    private final JobMetricsService metricsService;
    private final Clock clock;

    /**
     * Run a job on the calling thread.
     *
     * @param job     the job to run
     * @param trigger what started the run, for logging
     * @return the outcome; SKIPPED if the job was already running
     */
    public JobExecution run(JobDefinition job, String trigger) {
        if (!job.tryStart()) {
            log.warn("Job {} is already running; skipping {} trigger", job.getName(), trigger);
            return JobExecution.builder()
                    .jobName(job.getName())
                    .outcome(JobExecution.Outcome.SKIPPED)
                    .startedAt(clock.instant())
                    .duration(Duration.ZERO)
                    .build();
        }

        MDC.put("job", job.getName());
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();
        TaskQueueJobContext context = new TaskQueueJobContext(job.getName(), taskQueue, taskMonitor);
        JobExecution.Outcome outcome = JobExecution.Outcome.COMPLETED;
        String error = null;

        try {
            log.info("Running job {} ({})", job.getName(), trigger);
            job.getFunction().run(context);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Job {} interrupted", job.getName());
            outcome = JobExecution.Outcome.FAILED;
            error = "interrupted";
        } catch (Exception e) {
            log.error("Job {} failed: {}", job.getName(), e.getMessage(), e);
            outcome = JobExecution.Outcome.FAILED;
            error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        } finally {
            job.recordRun(startedAt);
            statusStore.saveLastRun(job.getName(), startedAt);
            job.finish();
            MDC.remove("job");
        }

        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
        boolean success = outcome == JobExecution.Outcome.COMPLETED;
        if (success) {
            Instant completedAt = clock.instant();
            job.recordCompletion(completedAt);
            statusStore.saveLastCompletion(job.getName(), completedAt);
        }
        metricsService.recordJobRun(job.getName(), success, duration);
        log.info("Job {} {} in {}ms", job.getName(), success ? "completed" : "failed", duration.toMillis());

        return JobExecution.builder()
                .jobName(job.getName())
                .outcome(outcome)
                .startedAt(startedAt)
                .duration(duration)
                .enqueuedTaskIds(context.getEnqueuedTaskIds())
                .error(error)
                .build();
    }
}

package com.marketdesk.jobs.service;

import com.marketdesk.jobs.domain.Task;
import com.marketdesk.jobs.infrastructure.TaskStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Fails running tasks whose worker stopped renewing the lease.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StaleTaskReaper {

    private final TaskStore taskStore;
    private final JobMetricsService metricsService;
    private final Clock clock;

    /**
     * Sweep the running set once.
     *
     * @return number of tasks failed
     */
    public int reap() {
        Instant now = clock.instant();
        int reaped = 0;

        for (String taskId : taskStore.runningTaskIds()) {
            Optional<Task> current = taskStore.find(taskId);
            if (current.isEmpty() || current.get().isTerminal()) {
                taskStore.untrackRunning(taskId);
                continue;
            }

            Task task = current.get();
            if (task.isLeaseExpired(now)) {
                Optional<Task> failed = taskStore.failExpired(taskId, now, "lease expired at "
                        + task.getLeaseExpiresAt() + ": worker " + task.getWorker() + " stopped responding");
                if (failed.isEmpty()) {
                    log.info("Task {} renewed its lease or finished before it could be reaped", taskId);
                    continue;
                }
                log.warn("Task {} ({}) lease expired at {} on worker {}",
                        taskId, task.getFunction(), task.getLeaseExpiresAt(), task.getWorker());
                metricsService.recordTaskReaped();
                reaped++;
            }
        }

        if (reaped > 0) {
            log.info("Reaped {} stale tasks", reaped);
        }
        return reaped;
    }
}

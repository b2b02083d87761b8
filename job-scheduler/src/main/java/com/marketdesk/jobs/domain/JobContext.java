package com.marketdesk.jobs.domain;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Handle given to a job while it runs.
 * Tasks enqueued through the context are remembered so callers can follow them.
 */
public interface JobContext {

    String getJobName();

    /**
     * Enqueue a task for the worker pool.
     *
     * @return the new task ID
     */
    String enqueue(String function, Map<String, Object> args);

    /**
     * Block until the task reaches a terminal status or the timeout elapses.
     *
     * @return the last observed task record
     */
    Task awaitTask(String taskId, Duration timeout, Duration pollInterval) throws InterruptedException;

    List<String> getEnqueuedTaskIds();
}

package com.marketdesk.jobs.infrastructure;

import com.marketdesk.jobs.domain.QueueEnvelope;
import com.marketdesk.jobs.domain.Task;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Work queue shared by producers (jobs, HTTP handlers) and workers.
 * Envelopes are popped in the order they were enqueued.
 */
public interface TaskQueue {

    /**
     * Create a queued task record and push its envelope.
     * Returns as soon as the envelope is on the queue; never waits for a worker.
     *
     * @return the new task ID
     */
    String enqueue(String function, Map<String, Object> args);

    /**
     * Pop the oldest envelope, blocking up to the timeout.
     *
     * @return the envelope, or empty if the queue stayed empty
     */
    Optional<QueueEnvelope> pop(Duration timeout);

    /**
     * Read the current task record.
     *
     * @throws com.marketdesk.jobs.exception.TaskNotFoundException if no record exists
     */
    Task poll(String taskId);

    /**
     * Envelopes waiting on the queue, oldest first.
     */
    List<QueueEnvelope> pending(int limit);

    long depth();

    /**
     * Drop every pending envelope and cancel the tasks they carried.
     *
     * @return the number of tasks moved to cancelled
     */
    int clear();

    /**
     * Cancel a task that no worker has picked up yet.
     *
     * @return true if the task was cancelled
     */
    boolean cancel(String taskId);
}

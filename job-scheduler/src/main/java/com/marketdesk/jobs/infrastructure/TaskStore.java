package com.marketdesk.jobs.infrastructure;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketdesk.jobs.domain.Task;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Keyed store of task records.
 * Transitions out of a terminal status are refused; startedAt and endedAt are set once.
 */
public interface TaskStore {

    /**
     * Write the whole record, replacing any previous value.
     */
    void save(Task task);

    Optional<Task> find(String taskId);

    /**
     * Move a queued task to running and start its lease.
     *
     * @return the updated record, or empty if the task is missing or not queued
     */
    Optional<Task> markRunning(String taskId, String workerName, Duration lease);

    /**
     * Append a log line. Renews the lease when the task is running.
     */
    void appendLog(String taskId, String level, String message, Duration leaseRenewal);

    /**
     * Push the lease of a running task forward without logging.
     *
     * @return false if the task is no longer running
     */
    boolean renewLease(String taskId, Duration lease);

    Optional<Task> complete(String taskId, JsonNode result);

    Optional<Task> fail(String taskId, String error);

    /**
     * Fail a running task only if its lease is still expired at {@code now}.
     * A lease renewed after the caller looked at the task keeps it alive.
     */
    Optional<Task> failExpired(String taskId, Instant now, String error);

    /**
     * Cancel a task that has not started yet.
     *
     * @return true if the task moved to cancelled
     */
    boolean cancelQueued(String taskId);

    /**
     * IDs of tasks currently tracked as running.
     */
    Set<String> runningTaskIds();

    void untrackRunning(String taskId);
}

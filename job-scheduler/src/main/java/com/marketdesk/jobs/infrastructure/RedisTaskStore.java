package com.marketdesk.jobs.infrastructure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketdesk.jobs.domain.Task;
import com.marketdesk.jobs.domain.TaskStatus;
import com.marketdesk.jobs.exception.TaskOperation;
import com.marketdesk.jobs.exception.TaskQueueException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Redis implementation of the task store.
 * Each record is a JSON string stored under the task ID with no expiry.
 * Running tasks are also tracked in a set so expired leases can be found.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RedisTaskStore implements TaskStore {

    public static final String RUNNING_SET_KEY = "tasks:running";

    private static final int MAX_UPDATE_ATTEMPTS = 10;

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public void save(Task task) {
        String json = serialize(task);
        try {
            redisTemplate.opsForValue().set(task.getId(), json);
        } catch (DataAccessException e) {
            log.error("Redis error while saving task {}: {}", task.getId(), e.getMessage(), e);
            throw new TaskQueueException(TaskOperation.UPDATE, task.getId(), "task store unavailable", e);
        }
    }

    @Override
    public Optional<Task> find(String taskId) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(taskId);
        } catch (DataAccessException e) {
            log.error("Redis error while reading task {}: {}", taskId, e.getMessage(), e);
            throw new TaskQueueException(TaskOperation.POLL, taskId, "task store unavailable", e);
        }
        if (json == null) {
            return Optional.empty();
        }
        return Optional.of(deserialize(json, taskId));
    }

    @Override
    public Optional<Task> markRunning(String taskId, String workerName, Duration lease) {
        Optional<Task> updated = update(taskId, task -> {
            if (task.getStatus() != TaskStatus.QUEUED) {
                return false;
            }
            Instant now = clock.instant();
            task.transitionTo(TaskStatus.RUNNING, now);
            task.setWorker(workerName);
            task.setLeaseExpiresAt(now.plus(lease));
            return true;
        });
        updated.ifPresent(task -> track(taskId));
        return updated;
    }

    @Override
    public void appendLog(String taskId, String level, String message, Duration leaseRenewal) {
        update(taskId, task -> {
            Instant now = clock.instant();
            task.addLog(level, message, now);
            if (task.getStatus() == TaskStatus.RUNNING && leaseRenewal != null) {
                task.setLeaseExpiresAt(now.plus(leaseRenewal));
            }
            return true;
        });
    }

    @Override
    public boolean renewLease(String taskId, Duration lease) {
        return update(taskId, task -> {
            if (task.getStatus() != TaskStatus.RUNNING) {
                return false;
            }
            task.setLeaseExpiresAt(clock.instant().plus(lease));
            return true;
        }).isPresent();
    }

    @Override
    public Optional<Task> complete(String taskId, JsonNode result) {
        Optional<Task> updated = update(taskId, task -> {
            if (!task.transitionTo(TaskStatus.COMPLETED, clock.instant())) {
                return false;
            }
            task.setResult(result);
            return true;
        });
        untrackRunning(taskId);
        return updated;
    }

    @Override
    public Optional<Task> fail(String taskId, String error) {
        Optional<Task> updated = update(taskId, task -> {
            if (!task.transitionTo(TaskStatus.FAILED, clock.instant())) {
                return false;
            }
            task.setError(error);
            return true;
        });
        untrackRunning(taskId);
        return updated;
    }

    @Override
    public Optional<Task> failExpired(String taskId, Instant now, String error) {
        Optional<Task> updated = update(taskId, task -> {
            if (!task.isLeaseExpired(now) || !task.transitionTo(TaskStatus.FAILED, clock.instant())) {
                return false;
            }
            task.setError(error);
            return true;
        });
        updated.ifPresent(task -> untrackRunning(taskId));
        return updated;
    }

    @Override
    public boolean cancelQueued(String taskId) {
        return update(taskId, task -> task.getStatus() == TaskStatus.QUEUED
                && task.transitionTo(TaskStatus.CANCELLED, clock.instant())).isPresent();
    }

    @Override
    public Set<String> runningTaskIds() {
        try {
            Set<String> members = redisTemplate.opsForSet().members(RUNNING_SET_KEY);
            return members == null ? Collections.emptySet() : members;
        } catch (DataAccessException e) {
            throw new TaskQueueException(TaskOperation.INSPECT, "running set unavailable", e);
        }
    }

    @Override
    public void untrackRunning(String taskId) {
        try {
            redisTemplate.opsForSet().remove(RUNNING_SET_KEY, taskId);
        } catch (DataAccessException e) {
            log.warn("Could not untrack running task {}: {}", taskId, e.getMessage());
        }
    }

    private void track(String taskId) {
        try {
            redisTemplate.opsForSet().add(RUNNING_SET_KEY, taskId);
        } catch (DataAccessException e) {
            log.warn("Could not track running task {}: {}", taskId, e.getMessage());
        }
    }

    /**
     * Optimistic read-modify-write of one record: WATCH the key, apply the mutator to a fresh copy,
     * and write it in MULTI/EXEC. A concurrent writer aborts the EXEC and the update is retried.
     *
     * @return the saved record, or empty if the task is missing or the mutator declined
     */
    private Optional<Task> update(String taskId, Predicate<Task> mutator) {
        for (int attempt = 1; attempt <= MAX_UPDATE_ATTEMPTS; attempt++) {
            UpdateResult result;
            try {
                result = redisTemplate.execute(new SessionCallback<UpdateResult>() {
                    @Override
                    @SuppressWarnings("unchecked")
                    public <K, V> UpdateResult execute(RedisOperations<K, V> operations) throws DataAccessException {
                        return watchedUpdate((RedisOperations<String, String>) operations, taskId, mutator);
                    }
                });
            } catch (DataAccessException e) {
                log.error("Redis error while updating task {}: {}", taskId, e.getMessage(), e);
                throw new TaskQueueException(TaskOperation.UPDATE, taskId, "task store unavailable", e);
            }

            if (result == null || result.conflicted) {
                log.debug("Task {} changed during update; retrying (attempt {})", taskId, attempt);
                continue;
            }
            if (result.task == null) {
                log.warn("Task {} not found for update", taskId);
                return Optional.empty();
            }
            if (!result.applied) {
                log.debug("Task {} left unchanged in status {}", taskId, result.task.getStatus());
                return Optional.empty();
            }
            return Optional.of(result.task);
        }
        throw new TaskQueueException(TaskOperation.UPDATE, taskId,
                "record kept changing during " + MAX_UPDATE_ATTEMPTS + " update attempts", null);
    }

    private UpdateResult watchedUpdate(RedisOperations<String, String> operations, String taskId,
            Predicate<Task> mutator) {
        operations.watch(taskId);
        String json = operations.opsForValue().get(taskId);
        if (json == null) {
            operations.unwatch();
            return new UpdateResult(null, false, false);
        }
        Task task = deserialize(json, taskId);
        if (!mutator.test(task)) {
            operations.unwatch();
            return new UpdateResult(task, false, false);
        }
        String updated = serialize(task);
        operations.multi();
        operations.opsForValue().set(taskId, updated);
        List<Object> results = operations.exec();
        boolean conflicted = results == null || results.isEmpty();
        return new UpdateResult(task, !conflicted, conflicted);
    }

    @RequiredArgsConstructor
    private static final class UpdateResult {
        private final Task task;
        private final boolean applied;
        private final boolean conflicted;
    }

    private Task deserialize(String json, String taskId) {
        try {
            return objectMapper.readValue(json, Task.class);
        } catch (JsonProcessingException e) {
            throw new TaskQueueException(TaskOperation.SERIALIZE, taskId, "unreadable task record", e);
        }
    }

    private String serialize(Task task) {
        try {
            return objectMapper.writeValueAsString(task);
        } catch (JsonProcessingException e) {
            throw new TaskQueueException(TaskOperation.SERIALIZE, task.getId(), "cannot serialize task", e);
        }
    }
}

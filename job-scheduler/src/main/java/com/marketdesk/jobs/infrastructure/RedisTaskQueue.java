package com.marketdesk.jobs.infrastructure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketdesk.jobs.config.JobsProperties;
import com.marketdesk.jobs.domain.QueueEnvelope;
import com.marketdesk.jobs.domain.Task;
import com.marketdesk.jobs.exception.TaskNotFoundException;
import com.marketdesk.jobs.exception.TaskOperation;
import com.marketdesk.jobs.exception.TaskQueueException;
import com.marketdesk.jobs.service.JobMetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Redis-based implementation of the TaskQueue.
 * Producers LPUSH envelopes and workers BRPOP from the other end, which gives FIFO order.
 * Thread-safe: Redis list operations are atomic.
 */
@Service
@Slf4j
public class RedisTaskQueue implements TaskQueue {

    private final StringRedisTemplate redisTemplate;
    private final TaskStore taskStore;
    private final ObjectMapper objectMapper;
    private final JobMetricsService metricsService;
    private final Clock clock;
    private final String queueKey;

    public RedisTaskQueue(StringRedisTemplate redisTemplate, TaskStore taskStore, ObjectMapper objectMapper,
            JobMetricsService metricsService, Clock clock, JobsProperties properties) {
        this.redisTemplate = redisTemplate;
        this.taskStore = taskStore;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
        this.clock = clock;
        this.queueKey = properties.getQueue().getKey();
    }

    @Override
    public String enqueue(String function, Map<String, Object> args) {
        if (function == null || function.isBlank()) {
            throw new IllegalArgumentException("Task function must not be blank");
        }

        String taskId = UUID.randomUUID().toString();
        Task task = Task.queued(taskId, function, args, clock.instant());
        String envelope = serialize(QueueEnvelope.builder()
                .id(taskId)
                .func(function)
                .args(task.getArgs())
                .build(), taskId);

        // The record must exist before any worker can pop the envelope
        taskStore.save(task);

        try {
            Long depth = redisTemplate.opsForList().leftPush(queueKey, envelope);
            log.info("Enqueued task {} ({}) on {}. Queue depth: {}", taskId, function, queueKey, depth);
        } catch (DataAccessException e) {
            log.error("Redis error while pushing task {} to queue: {}", taskId, e.getMessage(), e);
            markEnqueueFailed(taskId, e);
            throw new TaskQueueException(TaskOperation.ENQUEUE, taskId, "queue unavailable", e);
        }

        metricsService.recordTaskEnqueued();
        return taskId;
    }

    @Override
    public Optional<QueueEnvelope> pop(Duration timeout) {
        String value;
        try {
            // BRPOP is atomic: each envelope goes to exactly one worker
            value = redisTemplate.opsForList().rightPop(queueKey, timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (DataAccessException e) {
            log.error("Redis error while popping from queue: {}", e.getMessage(), e);
            throw new TaskQueueException(TaskOperation.POP, "queue unavailable", e);
        }

        if (value == null) {
            return Optional.empty();
        }

        try {
            QueueEnvelope envelope = objectMapper.readValue(value, QueueEnvelope.class);
            log.debug("Popped task {} from queue", envelope.getId());
            return Optional.of(envelope);
        } catch (JsonProcessingException e) {
            log.error("Discarding malformed queue entry: {}", value, e);
            return Optional.empty();
        }
    }

    @Override
    public Task poll(String taskId) {
        return taskStore.find(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    @Override
    public List<QueueEnvelope> pending(int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        List<String> raw;
        try {
            // The oldest entries sit at the right end of the list
            raw = redisTemplate.opsForList().range(queueKey, -limit, -1);
        } catch (DataAccessException e) {
            throw new TaskQueueException(TaskOperation.INSPECT, "queue unavailable", e);
        }
        if (raw == null || raw.isEmpty()) {
            return Collections.emptyList();
        }

        List<QueueEnvelope> envelopes = new ArrayList<>(raw.size());
        for (int i = raw.size() - 1; i >= 0; i--) {
            try {
                envelopes.add(objectMapper.readValue(raw.get(i), QueueEnvelope.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping malformed queue entry during inspection: {}", raw.get(i));
            }
        }
        return envelopes;
    }

    @Override
    public long depth() {
        try {
            Long size = redisTemplate.opsForList().size(queueKey);
            return size == null ? 0 : size;
        } catch (DataAccessException e) {
            throw new TaskQueueException(TaskOperation.INSPECT, "queue unavailable", e);
        }
    }

    @Override
    public int clear() {
        List<String> dropped = new ArrayList<>();
        try {
            String entry;
            while ((entry = redisTemplate.opsForList().rightPop(queueKey)) != null) {
                dropped.add(entry);
            }
        } catch (DataAccessException e) {
            log.error("Redis error while clearing queue after {} entries: {}", dropped.size(), e.getMessage(), e);
            cancelDropped(dropped);
            throw new TaskQueueException(TaskOperation.CLEAR, "queue unavailable", e);
        }
        int cancelled = cancelDropped(dropped);
        log.info("Cleared work queue {}: {} envelopes dropped, {} tasks cancelled", queueKey, dropped.size(), cancelled);
        return cancelled;
    }

    // Records of dropped envelopes would otherwise stay queued forever
    private int cancelDropped(List<String> dropped) {
        int cancelled = 0;
        for (String entry : dropped) {
            String taskId = readId(entry);
            if (taskId == null) {
                log.warn("Dropped malformed queue entry: {}", entry);
                continue;
            }
            try {
                if (taskStore.cancelQueued(taskId)) {
                    cancelled++;
                }
            } catch (TaskQueueException e) {
                log.error("Could not cancel dropped task {}: {}", taskId, e.getMessage());
            }
        }
        return cancelled;
    }

    @Override
    public boolean cancel(String taskId) {
        poll(taskId);
        if (!taskStore.cancelQueued(taskId)) {
            log.info("Task {} is no longer queued; not cancelled", taskId);
            return false;
        }

        try {
            List<String> raw = redisTemplate.opsForList().range(queueKey, 0, -1);
            if (raw != null) {
                for (String entry : raw) {
                    if (entry.contains(taskId) && taskId.equals(readId(entry))) {
                        redisTemplate.opsForList().remove(queueKey, 1, entry);
                        break;
                    }
                }
            }
        } catch (DataAccessException e) {
            // The record is already cancelled; workers skip it when popped
            log.warn("Could not remove envelope of cancelled task {}: {}", taskId, e.getMessage());
        }
        log.info("Cancelled task {}", taskId);
        return true;
    }

    private String readId(String entry) {
        try {
            return objectMapper.readValue(entry, QueueEnvelope.class).getId();
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private void markEnqueueFailed(String taskId, Exception cause) {
        try {
            taskStore.fail(taskId, "enqueue failed: " + cause.getMessage());
        } catch (TaskQueueException e) {
            log.error("Task {} could not be marked failed after push error: {}", taskId, e.getMessage());
        }
    }

    private String serialize(QueueEnvelope envelope, String taskId) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new TaskQueueException(TaskOperation.SERIALIZE, taskId, "cannot serialize envelope", e);
        }
    }
}

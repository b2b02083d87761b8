package com.marketdesk.jobs.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Record of a unit of background work, stored as JSON under its task ID.
 * Created by the producer, mutated by exactly one worker, read by pollers.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Task {

    private String id;

    private String function;

    @Builder.Default
    private Map<String, Object> args = new LinkedHashMap<>();

    private TaskStatus status;

    private String error;

    private JsonNode result;

    @Builder.Default
    private List<TaskLogEntry> logs = new ArrayList<>();

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("started_at")
    private Instant startedAt;

    @JsonProperty("ended_at")
    private Instant endedAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;

    @JsonProperty("lease_expires_at")
    private Instant leaseExpiresAt;

    @JsonProperty("worker")
    private String worker;

    /**
     * Create a freshly queued task.
     */
    public static Task queued(String id, String function, Map<String, Object> args, Instant now) {
        return Task.builder()
                .id(id)
                .function(function)
                .args(args == null ? new LinkedHashMap<>() : new LinkedHashMap<>(args))
                .status(TaskStatus.QUEUED)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Move the task to a new status.
     * startedAt is stamped on the first move into RUNNING and endedAt on the first
     * move into a terminal status. Terminal tasks never change again.
     *
     * @return false if the task was already terminal
     */
    public boolean transitionTo(TaskStatus next, Instant now) {
        if (status != null && status.isTerminal()) {
            return false;
        }
        status = next;
        updatedAt = now;
        if (next == TaskStatus.RUNNING && startedAt == null) {
            startedAt = now;
        }
        if (next.isTerminal()) {
            if (endedAt == null) {
                endedAt = now;
            }
            leaseExpiresAt = null;
        }
        return true;
    }

    public void addLog(String level, String message, Instant now) {
        if (logs == null) {
            logs = new ArrayList<>();
        }
        logs.add(new TaskLogEntry(now, level, message));
        updatedAt = now;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    @JsonIgnore
    public boolean isLeaseExpired(Instant now) {
        return status == TaskStatus.RUNNING && leaseExpiresAt != null && leaseExpiresAt.isBefore(now);
    }
}

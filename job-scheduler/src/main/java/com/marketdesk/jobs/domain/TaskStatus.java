package com.marketdesk.jobs.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status enum for background task lifecycle.
 * Serialized in lowercase to stay wire-compatible with external workers.
 */
public enum TaskStatus {
    QUEUED("queued"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String value;

    TaskStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    @JsonCreator
    public static TaskStatus fromValue(String value) {
        for (TaskStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        // Older workers reported failures as "error"
        if ("error".equalsIgnoreCase(value)) {
            return FAILED;
        }
        throw new IllegalArgumentException("Unknown task status: " + value);
    }
}

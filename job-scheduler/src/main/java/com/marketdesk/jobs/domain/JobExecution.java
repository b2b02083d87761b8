package com.marketdesk.jobs.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of one job invocation.
 */
@Value
@Builder
public class JobExecution {

    public enum Outcome {
        COMPLETED,
        FAILED,
        SKIPPED
    }

    String jobName;
    Outcome outcome;
    Instant startedAt;
    Duration duration;
    @Singular
    List<String> enqueuedTaskIds;
    String error;

    public boolean isSuccessful() {
        return outcome == Outcome.COMPLETED;
    }
}

package com.marketdesk.jobs.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A single log line appended to a task while it runs.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskLogEntry {

    private Instant timestamp;
    private String level;
    private String message;
}

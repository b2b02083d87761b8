package com.marketdesk.jobs.controller.dto;

import com.marketdesk.jobs.domain.JobDefinition;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalTime;
import java.util.List;

/**
 * Registry entry with its persisted run timestamps.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobView {

    private String name;
    private List<LocalTime> schedule;
    private boolean skipOnWeekends;
    private boolean runOnInit;
    private boolean running;
    private Instant lastRun;
    private Instant lastCompletion;

    public static JobView of(JobDefinition job, Instant lastRun, Instant lastCompletion) {
        return JobView.builder()
                .name(job.getName())
                .schedule(job.getSchedule())
                .skipOnWeekends(job.isSkipOnWeekends())
                .runOnInit(job.isRunOnInit())
                .running(job.isRunning())
                .lastRun(lastRun)
                .lastCompletion(lastCompletion)
                .build();
    }
}

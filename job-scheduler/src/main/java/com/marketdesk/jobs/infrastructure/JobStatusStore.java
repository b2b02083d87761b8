package com.marketdesk.jobs.infrastructure;

import java.time.Instant;
import java.util.Optional;

/**
 * Persistent last-run and last-completion timestamps per job.
 */
public interface JobStatusStore {

    void saveLastRun(String jobName, Instant at);

    void saveLastCompletion(String jobName, Instant at);

    Optional<Instant> findLastRun(String jobName);

    Optional<Instant> findLastCompletion(String jobName);
}

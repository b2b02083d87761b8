package com.marketdesk.jobs.service;

import com.marketdesk.jobs.domain.JobDefinition;
import com.marketdesk.jobs.exception.JobConfigurationException;
import com.marketdesk.jobs.exception.JobNotFoundException;
import com.marketdesk.jobs.infrastructure.JobStatusStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named catalog of scheduled jobs. Populated once at startup; jobs are never removed.
 */
@Slf4j
public class JobRegistry {

    private final Map<String, JobDefinition> jobs = new ConcurrentHashMap<>();

    /**
     * Register a job.
     *
     * @throws JobConfigurationException if a job with the same name exists
     */
    public void register(JobDefinition job) {
        JobDefinition existing = jobs.putIfAbsent(job.getName(), job);
        if (existing != null) {
            throw new JobConfigurationException("Duplicate job name: " + job.getName());
        }
        log.debug("Registered job {} at {}", job.getName(), job.getSchedule());
    }

    /**
     * All jobs sorted by name.
     */
    public List<JobDefinition> list() {
        List<JobDefinition> sorted = new ArrayList<>(jobs.values());
        sorted.sort(Comparator.comparing(JobDefinition::getName));
        return sorted;
    }

    public Optional<JobDefinition> find(String name) {
        return Optional.ofNullable(jobs.get(name));
    }

    public JobDefinition getRequired(String name) {
        return find(name).orElseThrow(() -> new JobNotFoundException(name));
    }

    /**
     * Copy persisted run timestamps into the in-memory definitions.
     */
    public void loadStatus(JobStatusStore statusStore) {
        for (JobDefinition job : jobs.values()) {
            statusStore.findLastRun(job.getName()).ifPresent(job::recordRun);
            statusStore.findLastCompletion(job.getName()).ifPresent(job::recordCompletion);
        }
    }

    public int size() {
        return jobs.size();
    }
}

package com.marketdesk.jobs.controller;

import com.marketdesk.jobs.controller.dto.JobView;
import com.marketdesk.jobs.domain.JobDefinition;
import com.marketdesk.jobs.infrastructure.JobStatusStore;
import com.marketdesk.jobs.service.JobRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only view of the job registry.
 */
@RestController
@RequestMapping("/jobs")
@RequiredArgsConstructor
@Slf4j
public class JobController {

    private final JobRegistry jobRegistry;
    private final JobStatusStore statusStore;

    @GetMapping
    public ResponseEntity<List<JobView>> listJobs() {
        log.debug("GET /jobs");
        return ResponseEntity.ok(jobRegistry.list().stream().map(this::toView).toList());
    }

    /**
     * Get one job by name.
     *
     * @param name the registered job name
     * @return the job with its last run and completion
     */
    @GetMapping("/{name}")
    public ResponseEntity<JobView> getJob(@PathVariable String name) {
        log.debug("GET /jobs/{}", name);
        return ResponseEntity.ok(toView(jobRegistry.getRequired(name)));
    }

    private JobView toView(JobDefinition job) {
        return JobView.of(job,
                statusStore.findLastRun(job.getName()).orElse(null),
                statusStore.findLastCompletion(job.getName()).orElse(null));
    }
}

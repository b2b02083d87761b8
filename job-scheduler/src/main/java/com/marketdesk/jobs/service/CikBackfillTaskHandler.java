package com.marketdesk.jobs.service;

import com.marketdesk.jobs.infrastructure.TaskContext;
import com.marketdesk.jobs.infrastructure.TaskHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Runs the CIK backfill as a queued task.
 */
@Component
@RequiredArgsConstructor
public class CikBackfillTaskHandler implements TaskHandler {

    public static final String NAME = "update_security_cik";

    private final CikBackfillService cikBackfillService;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Object execute(Map<String, Object> args, TaskContext context) {
        int updated = cikBackfillService.backfill();
        context.info("Assigned CIK to " + updated + " securities");
        return Map.of("updated", updated);
    }
}

package com.marketdesk.jobs.service;

import com.marketdesk.jobs.domain.ReconciliationSummary;
import com.marketdesk.jobs.infrastructure.TaskContext;
import com.marketdesk.jobs.infrastructure.TaskHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs securities reconciliation as a queued task.
 * Accepts optional "start" and "end" ISO dates; without them it resumes from the latest listing.
 */
@Component
@RequiredArgsConstructor
public class UpdateSecuritiesTaskHandler implements TaskHandler {

    public static final String NAME = "update_securities";

    static final int PROGRESS_EVERY_DAYS = 100;

    private final SecuritiesReconciler securitiesReconciler;
    private final Clock clock;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Object execute(Map<String, Object> args, TaskContext context) {
        Object start = args == null ? null : args.get("start");
        Object end = args == null ? null : args.get("end");

        // Each finished day renews the lease; a long backfill logs nothing else for hours
        AtomicInteger days = new AtomicInteger();
        Consumer<LocalDate> onDayDone = date -> {
            if (days.incrementAndGet() % PROGRESS_EVERY_DAYS == 0) {
                context.info("Reconciled through " + date + " (" + days.get() + " days)");
            } else {
                context.heartbeat();
            }
        };

        ReconciliationSummary summary;
        if (start != null) {
            LocalDate from = LocalDate.parse(start.toString());
            LocalDate to = end != null ? LocalDate.parse(end.toString()) : LocalDate.now(clock);
            context.info("Reconciling securities from " + from + " to " + to);
            summary = securitiesReconciler.reconcileHistory(from, to, onDayDone);
        } else {
            context.info("Reconciling securities since latest listing");
            summary = securitiesReconciler.reconcileSinceLatestListing(onDayDone);
        }
        context.info("Reconciliation finished: " + summary);
        return summary;
    }
}

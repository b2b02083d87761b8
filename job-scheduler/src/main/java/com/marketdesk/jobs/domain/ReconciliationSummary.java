package com.marketdesk.jobs.domain;

import lombok.Getter;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counters accumulated over one reconciliation run.
 */
@Getter
public class ReconciliationSummary {

    private final LocalDate startDate;
    private LocalDate endDate;
    private int daysProcessed;
    private int failures;
    private final Map<ListingAction, Integer> actionCounts = new EnumMap<>(ListingAction.class);

    public ReconciliationSummary(LocalDate startDate) {
        this.startDate = startDate;
    }

    public void recordDay(LocalDate date) {
        daysProcessed++;
        endDate = date;
    }

    public void record(ListingAction action) {
        actionCounts.merge(action, 1, Integer::sum);
    }

    public void recordFailure() {
        failures++;
    }

    /**
     * Fold the counters of one day into this run.
     */
    public void merge(ReconciliationSummary day) {
        day.actionCounts.forEach((action, count) -> actionCounts.merge(action, count, Integer::sum));
        failures += day.failures;
    }

    public int count(ListingAction action) {
        return actionCounts.getOrDefault(action, 0);
    }

    @Override
    public String toString() {
        return String.format("days=%d [%s..%s] actions=%s failures=%d",
                daysProcessed, startDate, endDate, actionCounts, failures);
    }
}

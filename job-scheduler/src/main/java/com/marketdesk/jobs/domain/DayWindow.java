package com.marketdesk.jobs.domain;

import lombok.Value;

import java.time.LocalDate;

/**
 * One step of the reconciliation walk: a date with its snapshot and the previous day's.
 */
@Value
public class DayWindow {

    LocalDate date;
    DailySnapshot today;
    DailySnapshot yesterday;

    public SnapshotDiff diff() {
        return SnapshotDiff.between(today, yesterday);
    }
}

package com.marketdesk.jobs.service;

import com.marketdesk.jobs.domain.DailySnapshot;
import com.marketdesk.jobs.domain.DayWindow;
import com.marketdesk.jobs.infrastructure.MarketDataProvider;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Walks a date range one calendar day at a time, yielding each day's snapshot with the
 * previous day's. Every date is fetched from the provider at most once.
 */
@Slf4j
public class SnapshotWindow implements Iterator<DayWindow> {

    private final MarketDataProvider provider;
    private final LocalDate end;
    private LocalDate nextDate;
    private DailySnapshot previous;

    /**
     * Window over [start, end]; the day before start is fetched as the first "yesterday".
     */
    public SnapshotWindow(MarketDataProvider provider, LocalDate start, LocalDate end) {
        this(provider, null, start, end);
    }

    /**
     * Window over [start, end] seeded with a known "yesterday" snapshot.
     */
    public SnapshotWindow(MarketDataProvider provider, DailySnapshot seed, LocalDate start, LocalDate end) {
        this.provider = provider;
        this.previous = seed;
        this.nextDate = start;
        this.end = end;
    }

    @Override
    public boolean hasNext() {
        return !nextDate.isAfter(end);
    }

    /**
     * @throws com.marketdesk.jobs.exception.MarketDataException if a snapshot cannot be fetched
     */
    @Override
    public DayWindow next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Window exhausted after " + end);
        }
        if (previous == null) {
            previous = fetch(nextDate.minusDays(1));
        }
        DailySnapshot today = fetch(nextDate);
        DayWindow window = new DayWindow(nextDate, today, previous);
        previous = today;
        nextDate = nextDate.plusDays(1);
        return window;
    }

    private DailySnapshot fetch(LocalDate date) {
        DailySnapshot snapshot = DailySnapshot.of(date, provider.fetchActiveTickers(date));
        log.debug("Snapshot {}: {} tickers", date, snapshot.size());
        return snapshot;
    }
}

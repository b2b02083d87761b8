package com.marketdesk.jobs.domain;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * The filtered set of active tickers for one calendar date, keyed and ordered by ticker.
 */
@Slf4j
public final class DailySnapshot {

    private final LocalDate date;
    private final Map<String, TickerListing> listings;

    private DailySnapshot(LocalDate date, Map<String, TickerListing> listings) {
        this.date = date;
        this.listings = Collections.unmodifiableMap(listings);
    }

    /**
     * Build a snapshot from raw provider listings.
     * Invalid tickers are dropped; when a ticker repeats, the first occurrence wins.
     */
    public static DailySnapshot of(LocalDate date, Collection<TickerListing> rawListings) {
        Map<String, TickerListing> filtered = new TreeMap<>();
        int rejected = 0;
        for (TickerListing listing : rawListings) {
            if (!TickerFilter.isValid(listing.getTicker())) {
                rejected++;
                continue;
            }
            if (listing.getCompositeFigi() == null) {
                listing.setCompositeFigi("");
            }
            TickerListing existing = filtered.putIfAbsent(listing.getTicker(), listing);
            if (existing != null) {
                log.debug("Duplicate ticker {} on {}; keeping FIGI {} over {}",
                        listing.getTicker(), date, existing.getCompositeFigi(), listing.getCompositeFigi());
            }
        }
        if (rejected > 0) {
            log.debug("Filtered {} invalid tickers from snapshot {}", rejected, date);
        }
        return new DailySnapshot(date, filtered);
    }

    /**
     * Build a snapshot from the currently active securities rows.
     */
    public static DailySnapshot fromActiveRows(LocalDate date, List<Security> activeRows) {
        List<TickerListing> listings = activeRows.stream()
                .map(row -> TickerListing.of(row.getTicker(), row.getFigi()))
                .toList();
        return of(date, listings);
    }

    public static DailySnapshot empty(LocalDate date) {
        return new DailySnapshot(date, new TreeMap<>());
    }

    public LocalDate getDate() {
        return date;
    }

    public Optional<TickerListing> get(String ticker) {
        return Optional.ofNullable(listings.get(ticker));
    }

    public boolean contains(String ticker) {
        return listings.containsKey(ticker);
    }

    public Set<String> tickers() {
        return listings.keySet();
    }

    public Collection<TickerListing> listings() {
        return listings.values();
    }

    public int size() {
        return listings.size();
    }
}

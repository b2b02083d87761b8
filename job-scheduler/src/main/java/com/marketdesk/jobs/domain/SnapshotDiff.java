package com.marketdesk.jobs.domain;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Three-way difference between two consecutive daily snapshots.
 * Additions, removals and FIGI changes are disjoint by ticker and ordered by ticker.
 */
@Getter
public final class SnapshotDiff {

    private final List<TickerListing> additions;
    private final List<TickerListing> removals;
    private final List<FigiChange> figiChanges;

    private SnapshotDiff(List<TickerListing> additions, List<TickerListing> removals,
            List<FigiChange> figiChanges) {
        this.additions = Collections.unmodifiableList(additions);
        this.removals = Collections.unmodifiableList(removals);
        this.figiChanges = Collections.unmodifiableList(figiChanges);
    }

    public static SnapshotDiff between(DailySnapshot today, DailySnapshot yesterday) {
        List<TickerListing> additions = new ArrayList<>();
        List<TickerListing> removals = new ArrayList<>();
        List<FigiChange> figiChanges = new ArrayList<>();

        for (TickerListing listing : today.listings()) {
            TickerListing previous = yesterday.get(listing.getTicker()).orElse(null);
            if (previous == null) {
                additions.add(listing);
            } else if (!previous.getCompositeFigi().equals(listing.getCompositeFigi())) {
                figiChanges.add(new FigiChange(listing.getTicker(), previous.getCompositeFigi(),
                        listing.getCompositeFigi()));
            }
        }

        for (TickerListing listing : yesterday.listings()) {
            if (!today.contains(listing.getTicker())) {
                removals.add(listing);
            }
        }

        return new SnapshotDiff(additions, removals, figiChanges);
    }

    public boolean isEmpty() {
        return additions.isEmpty() && removals.isEmpty() && figiChanges.isEmpty();
    }
}

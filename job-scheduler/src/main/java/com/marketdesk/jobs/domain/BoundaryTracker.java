package com.marketdesk.jobs.domain;

import com.marketdesk.jobs.exception.JobConfigurationException;

import java.time.LocalTime;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Tracks which daily boundary has fired.
 * OPEN fires once inside [open, close), CLOSE fires once at or after close, and
 * firing one boundary re-arms the other. Not thread-safe; owned by a single loop.
 */
public class BoundaryTracker {

    private final LocalTime openTime;
    private final LocalTime closeTime;
    private final Map<MarketBoundary, BoundaryState> states = new EnumMap<>(MarketBoundary.class);

    public BoundaryTracker(LocalTime openTime, LocalTime closeTime) {
        if (!openTime.isBefore(closeTime)) {
            throw new JobConfigurationException(
                    "Open time " + openTime + " must be before close time " + closeTime);
        }
        this.openTime = openTime;
        this.closeTime = closeTime;
        states.put(MarketBoundary.OPEN, BoundaryState.PENDING);
        states.put(MarketBoundary.CLOSE, BoundaryState.PENDING);
    }

    /**
     * Evaluate the boundaries for the given local time of day.
     *
     * @return the boundary that fired on this evaluation, if any
     */
    public Optional<MarketBoundary> evaluate(LocalTime now) {
        boolean inSession = !now.isBefore(openTime) && now.isBefore(closeTime);

        if (inSession && states.get(MarketBoundary.OPEN) == BoundaryState.PENDING) {
            states.put(MarketBoundary.OPEN, BoundaryState.FIRED);
            states.put(MarketBoundary.CLOSE, BoundaryState.PENDING);
            return Optional.of(MarketBoundary.OPEN);
        }

        if (!now.isBefore(closeTime) && states.get(MarketBoundary.CLOSE) == BoundaryState.PENDING) {
            states.put(MarketBoundary.CLOSE, BoundaryState.FIRED);
            states.put(MarketBoundary.OPEN, BoundaryState.PENDING);
            return Optional.of(MarketBoundary.CLOSE);
        }

        return Optional.empty();
    }

    public BoundaryState stateOf(MarketBoundary boundary) {
        return states.get(boundary);
    }

    /**
     * Boundary a schedule time belongs to.
     */
    public MarketBoundary boundaryFor(LocalTime scheduleTime) {
        boolean inSession = !scheduleTime.isBefore(openTime) && scheduleTime.isBefore(closeTime);
        return inSession ? MarketBoundary.OPEN : MarketBoundary.CLOSE;
    }

    public LocalTime getOpenTime() {
        return openTime;
    }

    public LocalTime getCloseTime() {
        return closeTime;
    }
}

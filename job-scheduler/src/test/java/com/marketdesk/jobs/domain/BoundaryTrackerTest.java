package com.marketdesk.jobs.domain;

import com.marketdesk.jobs.exception.JobConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for open/close boundary detection.
 */
class BoundaryTrackerTest {

    private BoundaryTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new BoundaryTracker(LocalTime.of(4, 0), LocalTime.of(20, 0));
    }

    @Test
    void testEvaluate_OpenFiresOnceInsideSession() {
        // Act
        Optional<MarketBoundary> first = tracker.evaluate(LocalTime.of(4, 0));
        Optional<MarketBoundary> second = tracker.evaluate(LocalTime.of(4, 1));
        Optional<MarketBoundary> third = tracker.evaluate(LocalTime.of(12, 0));

        // Assert
        assertEquals(Optional.of(MarketBoundary.OPEN), first);
        assertTrue(second.isEmpty());
        assertTrue(third.isEmpty());
        assertEquals(BoundaryState.FIRED, tracker.stateOf(MarketBoundary.OPEN));
        assertEquals(BoundaryState.PENDING, tracker.stateOf(MarketBoundary.CLOSE));
    }

    @Test
    void testEvaluate_CloseFiresAtCloseAndRearmsOpen() {
        // Arrange
        tracker.evaluate(LocalTime.of(9, 30));

        // Act
        Optional<MarketBoundary> atClose = tracker.evaluate(LocalTime.of(20, 0));
        Optional<MarketBoundary> later = tracker.evaluate(LocalTime.of(23, 59));

        // Assert
        assertEquals(Optional.of(MarketBoundary.CLOSE), atClose);
        assertTrue(later.isEmpty());
        assertEquals(BoundaryState.PENDING, tracker.stateOf(MarketBoundary.OPEN));
    }

    @Test
    void testEvaluate_FullDayFiresEachBoundaryOnce() {
        // Arrange
        int opens = 0;
        int closes = 0;

        // Act: sweep a whole day minute by minute from midnight
        LocalTime time = LocalTime.MIDNIGHT;
        for (int minute = 0; minute < 24 * 60; minute++) {
            Optional<MarketBoundary> fired = tracker.evaluate(time);
            if (fired.isPresent()) {
                if (fired.get() == MarketBoundary.OPEN) {
                    opens++;
                } else {
                    closes++;
                }
            }
            time = time.plusMinutes(1);
        }

        // Assert
        assertEquals(1, opens);
        assertEquals(1, closes);
    }

    @Test
    void testEvaluate_BeforeOpenNothingFiresAfterClose() {
        // Arrange
        tracker.evaluate(LocalTime.of(21, 0));

        // Act
        Optional<MarketBoundary> earlyMorning = tracker.evaluate(LocalTime.of(3, 59));

        // Assert
        assertTrue(earlyMorning.isEmpty());
    }

    @Test
    void testBoundaryFor_MapsScheduleTimes() {
        assertEquals(MarketBoundary.OPEN, tracker.boundaryFor(LocalTime.of(4, 0)));
        assertEquals(MarketBoundary.OPEN, tracker.boundaryFor(LocalTime.of(19, 59)));
        assertEquals(MarketBoundary.CLOSE, tracker.boundaryFor(LocalTime.of(20, 0)));
        assertEquals(MarketBoundary.CLOSE, tracker.boundaryFor(LocalTime.of(3, 55)));
    }

    @Test
    void testConstructor_RejectsOpenAfterClose() {
        assertThrows(JobConfigurationException.class,
                () -> new BoundaryTracker(LocalTime.of(20, 0), LocalTime.of(4, 0)));
    }
}

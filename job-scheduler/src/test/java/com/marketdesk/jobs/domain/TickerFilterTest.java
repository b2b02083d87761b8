package com.marketdesk.jobs.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TickerFilterTest {

    @Test
    void testIsValid_AcceptsPlainTickers() {
        assertTrue(TickerFilter.isValid("AAPL"));
        assertTrue(TickerFilter.isValid("BRK"));
        assertTrue(TickerFilter.isValid("X"));
    }

    @Test
    void testIsValid_RejectsDottedAndLowercase() {
        assertFalse(TickerFilter.isValid("BRK.A"));
        assertFalse(TickerFilter.isValid("ABCw"));
        assertFalse(TickerFilter.isValid("aapl"));
    }

    @Test
    void testIsValid_RejectsEmpty() {
        assertFalse(TickerFilter.isValid(""));
        assertFalse(TickerFilter.isValid(null));
    }
}

package com.bizsim.drg.util;

import org.apache.logging.log4j.LogManager;
import org.junit.Test;

import static org.junit.Assert.*;

public class ErrorRateLimiterTest {

    @Test
    public void testSuppressesWithinInterval() {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(ErrorRateLimiterTest.class), 60_000);
        RuntimeException e = new RuntimeException("boom");
        assertTrue(limiter.log("first", e));
        assertFalse(limiter.log("second", e));
        assertFalse(limiter.log("third", e));
        assertEquals(2, limiter.suppressedCount());
    }

    @Test
    public void testReportsSuppressedCountOnNextLine() throws Exception {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(ErrorRateLimiterTest.class), 1);
        RuntimeException e = new RuntimeException("boom");
        assertTrue(limiter.log("first", e));
        limiter.log("second", e);
        Thread.sleep(5);
        assertTrue(limiter.log("third", e));
        assertEquals(0, limiter.suppressedCount());
    }
}

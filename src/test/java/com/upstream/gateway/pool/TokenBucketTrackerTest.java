package com.upstream.gateway.pool;

import com.upstream.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TokenBucketTrackerTest {

    private MutableClock clock;
    private TokenBucketTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(0L);
        tracker = new TokenBucketTracker(clock);
        tracker.initialize("a");
    }

    @Test
    void newBucket_isFull() {
        assertEquals(50, tracker.getTokens("a"));
        assertEquals(50, tracker.getTokens("never-initialized"));
    }

    @Test
    void consumeTen_thenThreeIntervals_refillsToCapacity() {
        assertTrue(tracker.consumeTokens("a", 10));
        assertEquals(40, tracker.getTokens("a"));

        clock.advanceMillis(180_000);

        assertEquals(50, tracker.getTokens("a"));
    }

    @Test
    void refill_countsOnlyWholeIntervals() {
        tracker.consumeTokens("a", 20);

        clock.advanceMillis(59_999);
        assertEquals(30, tracker.getTokens("a"));

        clock.advanceMillis(1);
        assertEquals(36, tracker.getTokens("a"));
    }

    @Test
    void consume_failsWithoutChangingBucketWhenInsufficient() {
        assertTrue(tracker.consumeTokens("a", 50));
        assertFalse(tracker.hasTokens("a"));

        assertFalse(tracker.consumeTokens("a"));
        assertEquals(0, tracker.getTokens("a"));
    }

    @Test
    void reset_restoresFullBucket() {
        tracker.consumeTokens("a", 30);
        tracker.reset("a");

        assertEquals(50, tracker.getTokens("a"));
        assertTrue(tracker.hasTokens("a", 50));
    }
}

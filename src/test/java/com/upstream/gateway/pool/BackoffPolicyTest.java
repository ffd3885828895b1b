package com.upstream.gateway.pool;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class BackoffPolicyTest {

    private final BackoffPolicy policy = new BackoffPolicy(new Random(1));

    @Test
    void quotaExhausted_walksLadderAndClamps() {
        assertEquals(60_000L, policy.calculate(RateLimitReason.QUOTA_EXHAUSTED, 0));
        assertEquals(5 * 60_000L, policy.calculate(RateLimitReason.QUOTA_EXHAUSTED, 1));
        assertEquals(30 * 60_000L, policy.calculate(RateLimitReason.QUOTA_EXHAUSTED, 2));
        assertEquals(2 * 60 * 60_000L, policy.calculate(RateLimitReason.QUOTA_EXHAUSTED, 10));
        assertEquals(60_000L, policy.calculate(RateLimitReason.QUOTA_EXHAUSTED, -3));
    }

    @Test
    void flatReasons_useFixedDurations() {
        assertEquals(30_000L, policy.calculate(RateLimitReason.RATE_LIMIT_EXCEEDED, 5));
        assertEquals(60_000L, policy.calculate(RateLimitReason.UNKNOWN, 0));
    }

    @Test
    void jitteredReasons_stayWithinFifteenSeconds() {
        for (int i = 0; i < 200; i++) {
            long capacity = policy.calculate(RateLimitReason.MODEL_CAPACITY_EXHAUSTED, 0);
            assertTrue(capacity >= 30_000L && capacity <= 60_000L, "capacity backoff " + capacity);

            long unavailable = policy.calculate(RateLimitReason.SERVICE_UNAVAILABLE, 0);
            assertTrue(unavailable >= 45_000L && unavailable <= 75_000L, "unavailable backoff " + unavailable);
        }
    }

    @Test
    void jitter_coversBothEndsOfRange() {
        BackoffPolicy low = new BackoffPolicy(fixedDouble(0.0));
        BackoffPolicy high = new BackoffPolicy(fixedDouble(0.999_999_999));

        assertEquals(-15_000L, low.jitter(15_000L));
        assertEquals(15_000L, high.jitter(15_000L));
    }

    @Test
    void resolve_prefersRetryAfterWithTwoSecondFloor() {
        assertEquals(2_000L, policy.resolve(RateLimitReason.QUOTA_EXHAUSTED, 0, 500L));
        assertEquals(12_000L, policy.resolve(RateLimitReason.QUOTA_EXHAUSTED, 3, 12_000L));
        assertEquals(30_000L, policy.resolve(RateLimitReason.RATE_LIMIT_EXCEEDED, 0, 0L));
        assertEquals(30_000L, policy.resolve(RateLimitReason.RATE_LIMIT_EXCEEDED, 0, null));
    }

    private static Random fixedDouble(double value) {
        return new Random() {
            @Override
            public double nextDouble() {
                return value;
            }
        };
    }
}

package com.upstream.gateway.proxy;

import com.upstream.gateway.config.AppProperties;
import com.upstream.gateway.support.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class RetryHandlerTest {

    private RecordingSleeper sleeper;
    private RetryHandler handler;

    @BeforeEach
    void setUp() {
        sleeper = new RecordingSleeper();
        handler = new RetryHandler(new AppProperties(), new Random(11), sleeper);
    }

    @Test
    void getDelay_growsExponentiallyWithJitter() {
        for (int i = 0; i < 50; i++) {
            long first = handler.getDelay(1);
            assertTrue(first >= 500 && first < 750, "first " + first);
            long second = handler.getDelay(2);
            assertTrue(second >= 1000 && second < 1250, "second " + second);
            long third = handler.getDelay(3);
            assertTrue(third >= 2000 && third < 2250, "third " + third);
        }
    }

    @Test
    void getDelay_isCapped() {
        assertEquals(8_000L, handler.getDelay(5));
        assertEquals(8_000L, handler.getDelay(40));
    }

    @Test
    void waitBeforeRotate_capsSleep() {
        handler.waitBeforeRotate(60_000L);
        handler.waitBeforeRotate(800L);

        assertEquals(List.of(2_000L, 800L), sleeper.sleeps());
    }

    @Test
    void waitBeforeRetry_sleepsComputedDelay() {
        handler.waitBeforeRetry(1, "test");

        assertEquals(1, sleeper.sleeps().size());
        assertTrue(sleeper.sleeps().get(0) >= 500 && sleeper.sleeps().get(0) < 750);
        assertEquals(3, handler.maxRetries());
    }
}

package com.upstream.gateway.util;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SingleFlightTest {

    private final SingleFlight<String, String> flight = new SingleFlight<>();

    @Test
    void execute_sequentialCallsRunEachTime() {
        AtomicInteger calls = new AtomicInteger();

        flight.execute("k", () -> "v" + calls.incrementAndGet());
        String second = flight.execute("k", () -> "v" + calls.incrementAndGet());

        assertEquals("v2", second);
        assertEquals(2, calls.get());
    }

    @Test
    void execute_concurrentCallersShareResult() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicReference<String> waiterResult = new AtomicReference<>();

        Thread leader = new Thread(() -> flight.execute("k", () -> {
            calls.incrementAndGet();
            entered.countDown();
            await(release);
            return "shared";
        }));
        leader.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        Thread waiter = new Thread(() -> waiterResult.set(flight.execute("k", () -> {
            calls.incrementAndGet();
            return "own";
        })));
        waiter.start();
        waitUntilParked(waiter);
        release.countDown();
        leader.join(5_000L);
        waiter.join(5_000L);

        assertEquals(1, calls.get());
        assertEquals("shared", waiterResult.get());
    }

    @Test
    void execute_waitersReceiveLeaderException() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicReference<Throwable> waiterError = new AtomicReference<>();

        Thread leader = new Thread(() -> {
            try {
                flight.execute("k", () -> {
                    entered.countDown();
                    await(release);
                    throw new IllegalStateException("boom");
                });
            } catch (IllegalStateException expected) {
                assertEquals("boom", expected.getMessage());
            }
        });
        leader.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        Thread waiter = new Thread(() -> {
            try {
                flight.execute("k", () -> "unused");
            } catch (RuntimeException e) {
                waiterError.set(e);
            }
        });
        waiter.start();
        waitUntilParked(waiter);
        release.countDown();
        leader.join(5_000L);
        waiter.join(5_000L);

        assertInstanceOf(IllegalStateException.class, waiterError.get());
        assertEquals("after", flight.execute("k", () -> "after"));
    }

    @Test
    void execute_differentKeysDoNotShare() {
        assertEquals("a", flight.execute("a", () -> "a"));
        assertEquals("b", flight.execute("b", () -> "b"));
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void waitUntilParked(Thread thread) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000L;
        while (thread.getState() != Thread.State.WAITING && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
    }
}

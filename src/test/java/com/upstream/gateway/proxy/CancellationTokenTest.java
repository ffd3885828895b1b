package com.upstream.gateway.proxy;

import com.upstream.gateway.exception.RequestCancelledException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    void cancel_runsListenersOnce() {
        CancellationToken token = new CancellationToken();
        AtomicInteger runs = new AtomicInteger();
        token.onCancel(runs::incrementAndGet);

        token.cancel();
        token.cancel();

        assertTrue(token.isCancelled());
        assertEquals(1, runs.get());
        assertThrows(RequestCancelledException.class, token::throwIfCancelled);
    }

    @Test
    void onCancel_afterCancelRunsImmediately() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicInteger runs = new AtomicInteger();

        token.onCancel(runs::incrementAndGet);

        assertEquals(1, runs.get());
    }

    @Test
    void closedRegistration_isNotNotified() {
        CancellationToken token = new CancellationToken();
        AtomicInteger runs = new AtomicInteger();

        token.onCancel(runs::incrementAndGet).close();
        token.cancel();

        assertEquals(0, runs.get());
    }
}

package net.spookly.hostpilot.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

class CancellationTokenTest {
    @Test
    void cancelRunsCallbacksOnce() {
        CancellationToken token = new CancellationToken();
        AtomicInteger runs = new AtomicInteger();
        token.onCancel(runs::incrementAndGet);

        assertTrue(token.cancel());
        assertFalse(token.cancel());

        assertTrue(token.isCancelled());
        assertEquals(1, runs.get());
    }

    @Test
    void callbackRegisteredAfterCancelRunsImmediately() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicInteger runs = new AtomicInteger();

        token.onCancel(runs::incrementAndGet);

        assertEquals(1, runs.get());
    }

    @Test
    void failingCallbackDoesNotStopOthers() {
        CancellationToken token = new CancellationToken();
        AtomicInteger runs = new AtomicInteger();
        token.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        token.onCancel(runs::incrementAndGet);

        token.cancel();

        assertEquals(1, runs.get());
    }

    @Test
    void callbackRegisteredDuringCancelRunsExactlyOnce() throws InterruptedException {
        for (int i = 0; i < 500; i++) {
            CancellationToken token = new CancellationToken();
            AtomicInteger runs = new AtomicInteger();
            CountDownLatch go = new CountDownLatch(1);
            Thread registrar = new Thread(() -> {
                awaitQuietly(go);
                token.onCancel(runs::incrementAndGet);
            });
            Thread canceller = new Thread(() -> {
                awaitQuietly(go);
                token.cancel();
            });
            registrar.start();
            canceller.start();
            go.countDown();
            registrar.join();
            canceller.join();

            assertEquals(1, runs.get(), "iteration " + i);
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

package net.spookly.hostpilot.util;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared shutdown signal observed by every background loop of a client.
 *
 * <p>{@link #cancel()} is idempotent and safe from any thread. Callbacks registered after
 * cancellation run immediately on the registering thread.
 */
public final class CancellationToken {
    private static final Logger LOGGER = LoggerFactory.getLogger(CancellationToken.class);

    private final Object lock = new Object();
    private final List<Runnable> callbacks = new ArrayList<>();
    private volatile boolean cancelled;

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Cancel the token; returns true only for the call that flipped it.
     */
    public boolean cancel() {
        List<Runnable> pending;
        synchronized (lock) {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            pending = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        for (Runnable callback : pending) {
            runQuietly(callback);
        }
        return true;
    }

    /**
     * Register work to run once on cancellation.
     */
    public void onCancel(Runnable callback) {
        if (callback == null) {
            return;
        }
        synchronized (lock) {
            if (!cancelled) {
                callbacks.add(callback);
                return;
            }
        }
        runQuietly(callback);
    }

    private static void runQuietly(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            LOGGER.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }
}

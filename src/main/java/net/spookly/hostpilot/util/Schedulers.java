package net.spookly.hostpilot.util;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodic background loops bound to a {@link CancellationToken}.
 */
public final class Schedulers {
    private static final Logger LOGGER = LoggerFactory.getLogger(Schedulers.class);

    private Schedulers() {
    }

    /**
     * Single daemon thread scheduler that stops taking new runs once the token is cancelled.
     * A run already in flight is allowed to finish.
     */
    public static ScheduledExecutorService newLoopScheduler(String threadName, CancellationToken token) {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory(threadName));
        token.onCancel(scheduler::shutdown);
        return scheduler;
    }

    /**
     * Run {@code task} at a fixed rate. Failures are logged and never end the loop.
     */
    public static ScheduledFuture<?> scheduleLoop(ScheduledExecutorService scheduler,
                                                  CancellationToken token,
                                                  String name,
                                                  Runnable task,
                                                  long initialDelayMs,
                                                  long intervalMs) {
        Runnable guarded = () -> {
            if (token.isCancelled()) {
                return;
            }
            try {
                task.run();
            } catch (RuntimeException e) {
                LOGGER.error("Background loop '{}' failed: {}", name, e.getMessage(), e);
            }
        };
        return scheduler.scheduleAtFixedRate(guarded, initialDelayMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    private static ThreadFactory threadFactory(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }
}

package net.spookly.hostpilot.availability;

import java.util.concurrent.CompletableFuture;

/**
 * Executes an active probe against a host to determine reachability.
 */
public interface HealthProbe extends AutoCloseable {
    /**
     * Probe the host and complete with true when the probe succeeds.
     */
    CompletableFuture<Boolean> probe(String host, int timeoutMs);

    @Override
    default void close() {
    }
}

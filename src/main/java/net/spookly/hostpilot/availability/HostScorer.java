package net.spookly.hostpilot.availability;

import java.util.List;

/**
 * Produces one score per host from recent reachability.
 */
public interface HostScorer extends AutoCloseable {
    /**
     * Score the given hosts. An empty result means the pass failed.
     */
    List<HostScore> scoreHosts(List<String> hosts);

    @Override
    default void close() {
    }
}

package net.spookly.hostpilot.availability;

/**
 * Fetches the path to hosts mapping for a project from the management endpoint.
 */
public interface HostConfigFetcher extends AutoCloseable {
    /**
     * @param host management host to ask, normally the current best default host.
     */
    FetchResult fetch(String host, String projectId);

    @Override
    default void close() {
    }
}

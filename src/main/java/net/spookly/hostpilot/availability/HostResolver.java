package net.spookly.hostpilot.availability;

/**
 * Resolves the host that should serve a logical path.
 */
@FunctionalInterface
public interface HostResolver {
    String getHost(String path);
}

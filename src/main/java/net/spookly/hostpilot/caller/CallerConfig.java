package net.spookly.hostpilot.caller;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import lombok.With;
import lombok.experimental.Accessors;

/**
 * Transport tuning shared by every call of a client.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
@With
@ToString
public final class CallerConfig {
    public static final long DEFAULT_KEEP_ALIVE_DURATION_MS = 60_000L;
    public static final long DEFAULT_PING_INTERVAL_MS = 45_000L;
    public static final int DEFAULT_PING_TIMEOUT_MS = 500;
    public static final int DEFAULT_MAX_CONNECTIONS = 64;
    public static final int DEFAULT_CONNECT_TIMEOUT_MS = 3_000;
    public static final int DEFAULT_TIMEOUT_MS = 5_000;

    private final long keepAliveDurationMs;
    /** Heartbeat interval when keep-alive is enabled. */
    private final long pingIntervalMs;
    private final int pingTimeoutMs;
    /** Upper bound of in-flight calls per client. */
    private final int maxConnections;
    private final int connectTimeoutMs;
    /** Used when a call sets no timeout of its own. */
    private final int defaultTimeoutMs;

    public static CallerConfig defaults() {
        return new CallerConfig(
                DEFAULT_KEEP_ALIVE_DURATION_MS,
                DEFAULT_PING_INTERVAL_MS,
                DEFAULT_PING_TIMEOUT_MS,
                DEFAULT_MAX_CONNECTIONS,
                DEFAULT_CONNECT_TIMEOUT_MS,
                DEFAULT_TIMEOUT_MS
        );
    }

    /**
     * Copy with every unset (non-positive) value replaced by its default.
     */
    public CallerConfig withDefaults() {
        return new CallerConfig(
                keepAliveDurationMs > 0 ? keepAliveDurationMs : DEFAULT_KEEP_ALIVE_DURATION_MS,
                pingIntervalMs > 0 ? pingIntervalMs : DEFAULT_PING_INTERVAL_MS,
                pingTimeoutMs > 0 ? pingTimeoutMs : DEFAULT_PING_TIMEOUT_MS,
                maxConnections > 0 ? maxConnections : DEFAULT_MAX_CONNECTIONS,
                connectTimeoutMs > 0 ? connectTimeoutMs : DEFAULT_CONNECT_TIMEOUT_MS,
                defaultTimeoutMs > 0 ? defaultTimeoutMs : DEFAULT_TIMEOUT_MS
        );
    }
}

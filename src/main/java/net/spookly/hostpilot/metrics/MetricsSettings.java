package net.spookly.hostpilot.metrics;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import lombok.With;
import lombok.experimental.Accessors;

@Getter
@Accessors(fluent = true)
@AllArgsConstructor
@With
@ToString
public final class MetricsSettings {
    public static final long DEFAULT_FLUSH_INTERVAL_MS = 10_000L;
    public static final int DEFAULT_QUEUE_CAPACITY = 65_536;
    public static final int DEFAULT_SEND_TIMEOUT_MS = 800;
    public static final int DEFAULT_SEND_ATTEMPTS = 2;
    public static final String DEFAULT_PREFIX = "hostpilot.sdk";
    /** Shorter intervals are ignored in favour of the default. */
    public static final long MIN_FLUSH_INTERVAL_MS = 500L;

    private final boolean enabled;
    private final boolean logsEnabled;
    private final long flushIntervalMs;
    private final int queueCapacity;
    private final int sendTimeoutMs;
    private final int sendAttempts;
    private final String prefix;

    public static MetricsSettings defaults() {
        return new MetricsSettings(
                false,
                false,
                DEFAULT_FLUSH_INTERVAL_MS,
                DEFAULT_QUEUE_CAPACITY,
                DEFAULT_SEND_TIMEOUT_MS,
                DEFAULT_SEND_ATTEMPTS,
                DEFAULT_PREFIX
        );
    }

    public long effectiveFlushIntervalMs() {
        return flushIntervalMs > MIN_FLUSH_INTERVAL_MS ? flushIntervalMs : DEFAULT_FLUSH_INTERVAL_MS;
    }
}

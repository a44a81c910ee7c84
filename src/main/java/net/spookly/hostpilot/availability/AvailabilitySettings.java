package net.spookly.hostpilot.availability;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import lombok.With;
import lombok.experimental.Accessors;

/**
 * Tuning for host scoring and remote refresh.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
@With
@ToString
public final class AvailabilitySettings {
    public static final long DEFAULT_SCORE_INTERVAL_MS = 1_000L;
    public static final long DEFAULT_REFRESH_INTERVAL_MS = 10_000L;
    public static final int DEFAULT_PING_TIMEOUT_MS = 300;
    public static final int DEFAULT_WINDOW_SIZE = 60;
    public static final double DEFAULT_FAILURE_RATE_THRESHOLD = 0.1;
    public static final int DEFAULT_FETCH_TIMEOUT_MS = 5_000;
    public static final int DEFAULT_FETCH_ATTEMPTS = 3;

    private final long scoreIntervalMs;
    private final long refreshIntervalMs;
    private final int pingTimeoutMs;
    private final int windowSize;
    /**
     * When every host of a pass fails at or above this rate, the pass keeps the current order.
     */
    private final double failureRateThreshold;
    private final int fetchTimeoutMs;
    private final int fetchAttempts;

    public static AvailabilitySettings defaults() {
        return new AvailabilitySettings(
                DEFAULT_SCORE_INTERVAL_MS,
                DEFAULT_REFRESH_INTERVAL_MS,
                DEFAULT_PING_TIMEOUT_MS,
                DEFAULT_WINDOW_SIZE,
                DEFAULT_FAILURE_RATE_THRESHOLD,
                DEFAULT_FETCH_TIMEOUT_MS,
                DEFAULT_FETCH_ATTEMPTS
        );
    }
}

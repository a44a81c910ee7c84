package net.spookly.hostpilot.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Free-text diagnostic record keyed by request id.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
@ToString
public final class LogEvent {
    @JsonProperty("id")
    private final String id;
    @JsonProperty("message")
    private final String message;
    @JsonProperty("level")
    private final LogLevel level;
    /** Epoch seconds. */
    @JsonProperty("timestamp")
    private final long timestamp;
}

package net.spookly.hostpilot.metrics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * One metric record, both as emitted and as shipped after aggregation.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
public final class MetricEvent {
    @JsonProperty("name")
    private final String name;
    @JsonProperty("value")
    private final double value;
    @JsonProperty("type")
    private final MetricType type;
    /** Epoch seconds. */
    @JsonProperty("timestamp")
    private final long timestamp;
    @JsonProperty("tags")
    private final Map<String, String> tags;

    public MetricEvent(String name, double value, MetricType type, long timestamp, Map<String, String> tags) {
        this.name = Objects.requireNonNull(name, "name");
        this.value = value;
        this.type = Objects.requireNonNull(type, "type");
        this.timestamp = timestamp;
        this.tags = tags == null || tags.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }
}

package net.spookly.hostpilot.metrics;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MetricType {
    /** Summed per flush. */
    COUNTER("counter"),
    /** Reported as distribution stats per flush. */
    TIMER("timer"),
    /** Last value wins. */
    STORE("store");

    private final String wireName;

    MetricType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}

package net.spookly.hostpilot.metrics;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LogLevel {
    INFO,
    WARN,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

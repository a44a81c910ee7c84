package net.spookly.hostpilot.caller;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

/**
 * Per-call settings. Create a fresh instance for every call.
 */
@Getter
@Setter
@Accessors(fluent = true)
public final class CallOptions {
    private String requestId;
    /** Client-side bound for the whole exchange, permit wait included. */
    private Duration timeout;
    /** Hint for the server, sent as {@code Timeout-Millis}. */
    private Duration serverTimeout;
    @Getter(AccessLevel.NONE)
    private final Map<String, String> headers = new LinkedHashMap<>();
    @Getter(AccessLevel.NONE)
    private final Map<String, String> queryParams = new LinkedHashMap<>();

    public static CallOptions create() {
        return new CallOptions();
    }

    public CallOptions header(String name, String value) {
        headers.put(Objects.requireNonNull(name, "header name"),
                Objects.requireNonNull(value, () -> "value of header " + name));
        return this;
    }

    public CallOptions headers(Map<String, String> values) {
        if (values != null) {
            values.forEach(this::header);
        }
        return this;
    }

    public CallOptions query(String name, String value) {
        queryParams.put(name, value);
        return this;
    }

    public CallOptions queries(Map<String, String> values) {
        if (values != null) {
            queryParams.putAll(values);
        }
        return this;
    }

    public Map<String, String> headers() {
        return Collections.unmodifiableMap(headers);
    }

    public Map<String, String> queryParams() {
        return Collections.unmodifiableMap(queryParams);
    }
}

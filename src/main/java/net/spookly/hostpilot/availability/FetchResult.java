package net.spookly.hostpilot.availability;

import java.util.List;
import java.util.Map;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Outcome of one host-config refresh, after retries.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@ToString
public final class FetchResult {
    public enum Status {
        /** A path to hosts mapping was returned. */
        OK,
        /** The endpoint has no config for the project; defaults stay. */
        NOT_FOUND,
        /** The response could not be decoded. */
        INVALID,
        /** Every attempt failed at the transport or with a non-2xx status. */
        FAILED
    }

    private final Status status;
    private final Map<String, List<String>> hosts;

    public static FetchResult ok(Map<String, List<String>> hosts) {
        return new FetchResult(Status.OK, hosts);
    }

    public static FetchResult notFound() {
        return new FetchResult(Status.NOT_FOUND, null);
    }

    public static FetchResult invalid() {
        return new FetchResult(Status.INVALID, null);
    }

    public static FetchResult failed() {
        return new FetchResult(Status.FAILED, null);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}

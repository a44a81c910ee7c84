package net.spookly.hostpilot.caller;

/**
 * The server answered with a status other than 200.
 */
public class StatusException extends CallException {
    private final int statusCode;
    private final String body;

    public StatusException(String message, String requestId, int statusCode, String body) {
        super(message, requestId);
        this.statusCode = statusCode;
        this.body = body;
    }

    public int statusCode() {
        return statusCode;
    }

    /**
     * Decompressed response body, or an empty string.
     */
    public String body() {
        return body;
    }
}

package net.spookly.hostpilot.caller;

/**
 * Base of every error a signed call can end with.
 */
public class CallException extends Exception {
    private final String requestId;

    public CallException(String message, String requestId) {
        super(message);
        this.requestId = requestId;
    }

    public CallException(String message, String requestId, Throwable cause) {
        super(message, cause);
        this.requestId = requestId;
    }

    public String requestId() {
        return requestId;
    }
}

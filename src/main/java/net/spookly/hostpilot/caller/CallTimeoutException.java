package net.spookly.hostpilot.caller;

public class CallTimeoutException extends NetException {
    public CallTimeoutException(String message, String requestId, Throwable cause) {
        super(message, requestId, cause);
    }
}

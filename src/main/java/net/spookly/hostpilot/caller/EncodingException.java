package net.spookly.hostpilot.caller;

/**
 * Payload could not be serialized, compressed, decompressed or deserialized.
 */
public class EncodingException extends CallException {
    public EncodingException(String message, String requestId, Throwable cause) {
        super(message, requestId, cause);
    }

    public EncodingException(String message, String requestId) {
        super(message, requestId);
    }
}

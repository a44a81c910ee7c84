package net.spookly.hostpilot.caller;

/**
 * Classifies the {@code Status.Code} carried in service response bodies.
 *
 * <p>These are application codes, not HTTP statuses; a call that returned them already
 * passed the HTTP 200 check.
 */
public final class StatusCodes {
    /** Executed without any exception. */
    public static final int SUCCESS = 0;
    /** A request with the same {@code Request-Id} was already received; this one was rejected. */
    public static final int IDEMPOTENT = 409;
    /** Operation data was lost on the server side. */
    public static final int OPERATION_LOSS = 410;
    /** The server asks the client to slow down; this request was rejected. */
    public static final int TOO_MANY_REQUESTS = 429;

    private StatusCodes() {
    }

    public static boolean isSuccess(int code) {
        return code == SUCCESS || code == 200;
    }

    /**
     * An upload rejected as a duplicate still counts as delivered.
     */
    public static boolean isUploadSuccess(int code) {
        return code == SUCCESS || code == IDEMPOTENT;
    }

    public static boolean isServerOverload(int code) {
        return code == TOO_MANY_REQUESTS;
    }

    public static boolean isLossOperation(int code) {
        return code == OPERATION_LOSS;
    }
}

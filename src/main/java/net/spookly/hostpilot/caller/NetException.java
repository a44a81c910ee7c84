package net.spookly.hostpilot.caller;

/**
 * Transport-level failure. The message always starts with {@link #NET_ERR_MARK}.
 */
public class NetException extends CallException {
    public static final String NET_ERR_MARK = "[netErr]";

    public NetException(String message, String requestId, Throwable cause) {
        super(mark(message), requestId, cause);
    }

    /**
     * True when {@code error} or one of its causes is a transport failure.
     */
    public static boolean isNetError(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof NetException) {
                return true;
            }
            String message = current.getMessage();
            if (message != null && message.contains(NET_ERR_MARK)) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    private static String mark(String message) {
        if (message == null) {
            return NET_ERR_MARK;
        }
        return message.startsWith(NET_ERR_MARK) ? message : NET_ERR_MARK + " " + message;
    }
}

package net.spookly.hostpilot.config;

/**
 * Invalid or unreadable configuration. Raised synchronously while building a client.
 */
public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}

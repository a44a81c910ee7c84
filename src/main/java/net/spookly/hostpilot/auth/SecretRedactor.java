package net.spookly.hostpilot.auth;

/**
 * Redacts secret values for logs and printed config.
 */
public final class SecretRedactor {
    public static final String REDACTED = "REDACTED";

    private SecretRedactor() {
    }

    /**
     * @return {@code null} for {@code null}, empty for empty, otherwise {@code REDACTED}
     */
    public static String redact(String secret) {
        if (secret == null) {
            return null;
        }
        if (secret.isEmpty()) {
            return "";
        }
        return REDACTED;
    }
}

package net.spookly.hostpilot.util;

public final class Strings {
    private Strings() {
    }

    public static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    /**
     * Escape characters that would break the metrics tag wire format.
     */
    public static String escapeTagValue(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("?", "-qu-")
                .replace("&", "-and-")
                .replace("=", "-eq-");
    }
}

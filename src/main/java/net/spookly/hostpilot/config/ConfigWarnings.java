package net.spookly.hostpilot.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Collects non-fatal configuration warnings (for example, insecure file permissions).
 */
public final class ConfigWarnings {
    static final int MIN_USEFUL_WINDOW_SIZE = 10;

    private ConfigWarnings() {
    }

    public static List<String> collect(HostpilotConfig config) {
        List<String> warnings = new ArrayList<>();
        if (config == null) {
            return warnings;
        }
        HostpilotConfig.ClientConfig client = config.client;
        if (client != null && "http".equalsIgnoreCase(client.schema) && config.auth != null) {
            warnings.add("client.schema is http; signed requests and credentials travel unencrypted");
        }
        HostpilotConfig.CallerConfig caller = config.caller;
        if (caller != null && caller.pingIntervalMs != null && caller.keepAliveDurationMs != null
                && caller.pingIntervalMs >= caller.keepAliveDurationMs) {
            warnings.add("caller.pingIntervalMs should be below caller.keepAliveDurationMs or idle connections close between heartbeats");
        }
        HostpilotConfig.AvailabilityConfig availability = config.availability;
        if (availability != null && availability.windowSize != null && availability.windowSize < MIN_USEFUL_WINDOW_SIZE) {
            warnings.add("availability.windowSize below " + MIN_USEFUL_WINDOW_SIZE + " makes host ranking jumpy");
        }
        if (config.secretFiles != null) {
            for (Path file : config.secretFiles) {
                warnIfWorldReadable(warnings, file);
            }
        }
        return warnings;
    }

    private static void warnIfWorldReadable(List<String> warnings, Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            return;
        }
        PosixFileAttributeView view = Files.getFileAttributeView(file, PosixFileAttributeView.class);
        if (view == null) {
            return;
        }
        try {
            Set<PosixFilePermission> permissions = view.readAttributes().permissions();
            if (permissions.contains(PosixFilePermission.OTHERS_READ)) {
                warnings.add("secret file is world-readable: " + file);
            }
        } catch (IOException e) {
            warnings.add("could not read permissions of " + file + ": " + e.getMessage());
        }
    }
}

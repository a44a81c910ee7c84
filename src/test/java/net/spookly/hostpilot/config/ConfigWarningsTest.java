package net.spookly.hostpilot.config;

import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigWarningsTest {
    @Test
    void warnsOnWorldReadableSecretFile(@TempDir Path tempDir) throws Exception {
        Path secretFile = tempDir.resolve("secret_key");
        Files.writeString(secretFile, "dummy");
        PosixFileAttributeView view = Files.getFileAttributeView(secretFile, PosixFileAttributeView.class);
        Assumptions.assumeTrue(view != null, "POSIX permissions not supported");
        Set<PosixFilePermission> perms = EnumSet.of(
                PosixFilePermission.OWNER_READ,
                PosixFilePermission.OWNER_WRITE,
                PosixFilePermission.OTHERS_READ
        );
        Files.setPosixFilePermissions(secretFile, perms);

        HostpilotConfig config = ConfigValidatorTest.hmacConfig();
        config.secretFiles.add(secretFile);

        List<String> warnings = ConfigWarnings.collect(config);
        assertTrue(warnings.stream().anyMatch(message -> message.contains("world-readable")));
    }

    @Test
    void warnsOnPlainHttpAndSlowHeartbeat() {
        HostpilotConfig config = ConfigValidatorTest.hmacConfig();
        config.client.schema = "http";
        config.caller = new HostpilotConfig.CallerConfig();
        config.caller.pingIntervalMs = 60_000L;
        config.caller.keepAliveDurationMs = 30_000L;
        config.availability = new HostpilotConfig.AvailabilityConfig();
        config.availability.windowSize = 3;

        List<String> warnings = ConfigWarnings.collect(config);

        assertTrue(warnings.stream().anyMatch(message -> message.contains("client.schema is http")));
        assertTrue(warnings.stream().anyMatch(message -> message.contains("caller.pingIntervalMs")));
        assertTrue(warnings.stream().anyMatch(message -> message.contains("availability.windowSize")));
    }
}

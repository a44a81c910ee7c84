package net.spookly.hostpilot.config;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ConfigPrinterTest {
    @Test
    void redactsCredentials() {
        HostpilotConfig config = ConfigValidatorTest.hmacConfig();
        config.auth.secretKey = "super-secret";
        config.auth.sessionToken = "session-secret";

        String yaml = ConfigPrinter.toYaml(config);

        assertFalse(yaml.contains("super-secret"));
        assertFalse(yaml.contains("session-secret"));
        assertTrue(yaml.contains("secretKey: <redacted>"));
        assertTrue(yaml.contains("accessKeyId: ak"));
        assertFalse(yaml.contains("secretFiles"));
    }
}

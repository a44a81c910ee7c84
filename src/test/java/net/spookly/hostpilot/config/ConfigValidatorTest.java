package net.spookly.hostpilot.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class ConfigValidatorTest {
    @Test
    void acceptsMinimalHmacConfig() {
        assertDoesNotThrow(() -> ConfigValidator.validate(hmacConfig()));
    }

    @Test
    void reportsEveryProblemAtOnce() {
        HostpilotConfig config = hmacConfig();
        config.client.tenantId = " ";
        config.client.hosts = List.of("h1", "h1", "https://h2/path");
        config.auth.secretKey = null;
        config.client.region = null;
        config.availability = new HostpilotConfig.AvailabilityConfig();
        config.availability.failureRateThreshold = 1.5;
        config.availability.windowSize = 0;

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigValidator.validate(config));

        String message = exception.getMessage();
        assertTrue(message.startsWith("Invalid config:\n"));
        assertTrue(message.contains("- client.tenantId is required"));
        assertTrue(message.contains("client.hosts contains duplicate host: h1"));
        assertTrue(message.contains("without scheme or path: https://h2/path"));
        assertTrue(message.contains("- auth.secretKey is required"));
        assertTrue(message.contains("auth.region or client.region is required for hmac auth"));
        assertTrue(message.contains("availability.failureRateThreshold must be in (0, 1]"));
        assertTrue(message.contains("availability.windowSize must be > 0"));
    }

    @Test
    void airAuthNeedsOnlyToken() {
        HostpilotConfig config = hmacConfig();
        config.auth = new HostpilotConfig.AuthConfig();
        config.auth.mode = "AIR";
        config.client.region = null;

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigValidator.validate(config));
        assertTrue(exception.getMessage().contains("auth.token is required"));

        config.auth.token = "tok";
        assertDoesNotThrow(() -> ConfigValidator.validate(config));
    }

    @Test
    void missingSectionsAreReported() {
        ConfigException exception = assertThrows(ConfigException.class,
                () -> ConfigValidator.validate(new HostpilotConfig()));

        assertTrue(exception.getMessage().contains("client section is required"));
        assertTrue(exception.getMessage().contains("auth section is required"));
    }

    static HostpilotConfig hmacConfig() {
        HostpilotConfig config = new HostpilotConfig();
        config.client = new HostpilotConfig.ClientConfig();
        config.client.tenantId = "tenant-1";
        config.client.region = "cn-north-1";
        config.client.hosts = List.of("h1.example.com");
        config.auth = new HostpilotConfig.AuthConfig();
        config.auth.accessKeyId = "ak";
        config.auth.secretKey = "sk";
        return config;
    }
}

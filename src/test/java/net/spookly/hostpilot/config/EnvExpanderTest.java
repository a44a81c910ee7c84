package net.spookly.hostpilot.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EnvExpanderTest {
    @Test
    void replacesEnvValuesInNestedStructures() {
        EnvExpander expander = new EnvExpander(null, Map.of("SK", "secret")::get);
        Object raw = Map.of("auth", Map.of("secretKey", "env:SK", "list", List.of("env:SK", 3)));

        Object expanded = expander.expand(raw);

        assertEquals(Map.of("auth", Map.of("secretKey", "secret", "list", List.of("secret", 3))), expanded);
        assertTrue(expander.secretFiles().isEmpty());
    }

    @Test
    void unsetVariableUsesFallback() {
        EnvExpander expander = new EnvExpander(null, name -> null);

        assertEquals("cn-north-1", expander.expand("env:HOSTPILOT_REGION:-cn-north-1"));
        assertEquals("", expander.expand("env:HOSTPILOT_PROJECT_ID:-"));
    }

    @Test
    void missingEnvironmentVariableFails() {
        ConfigException exception = assertThrows(ConfigException.class,
                () -> new EnvExpander(null, name -> null).expand("env:NOPE"));

        assertEquals("Missing required environment variable: NOPE", exception.getMessage());
    }

    @Test
    void readsPathValuesRelativeToBaseDirAndRemembersThem(@TempDir Path tempDir) throws Exception {
        Files.writeString(tempDir.resolve("secret_key"), "  sk-value\n", StandardCharsets.UTF_8);
        EnvExpander expander = new EnvExpander(tempDir, name -> null);

        assertEquals("sk-value", expander.expand("path:secret_key"));
        assertEquals(List.of(tempDir.resolve("secret_key")), expander.secretFiles());
    }

    @Test
    void missingOrEmptyPathFileFails(@TempDir Path tempDir) throws Exception {
        Files.writeString(tempDir.resolve("empty"), "\n", StandardCharsets.UTF_8);
        EnvExpander expander = new EnvExpander(tempDir, name -> null);

        assertThrows(ConfigException.class, () -> expander.expand("path:does/not/exist"));
        assertThrows(ConfigException.class, () -> expander.expand("path:empty"));
        assertThrows(ConfigException.class, () -> expander.expand("path:"));
    }
}

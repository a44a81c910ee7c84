package net.spookly.hostpilot.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.util.Map;

/**
 * Renders the effective configuration with sensitive values redacted.
 */
public final class ConfigPrinter {
    private static final String REDACTED = "<redacted>";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConfigPrinter() {
    }

    public static String toYaml(HostpilotConfig config) {
        @SuppressWarnings("unchecked")
        Map<String, Object> data = MAPPER.convertValue(config, Map.class);
        redactSensitiveValues(data);
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        return new Yaml(options).dump(data);
    }

    @SuppressWarnings("unchecked")
    private static void redactSensitiveValues(Map<String, Object> data) {
        if (data == null) {
            return;
        }
        Object auth = data.get("auth");
        if (auth instanceof Map) {
            Map<String, Object> authMap = (Map<String, Object>) auth;
            redact(authMap, "secretKey");
            redact(authMap, "sessionToken");
            redact(authMap, "token");
        }
    }

    private static void redact(Map<String, Object> section, String key) {
        if (section.get(key) != null) {
            section.put(key, REDACTED);
        }
    }
}

package net.spookly.hostpilot.config;

/**
 * Default configuration template written when no config file exists.
 */
public final class ConfigDefaults {
    private static final String DEFAULT_YAML_TEMPLATE = """
            # Generated default hostpilot config.
            # Credentials are read from the environment; never commit them here.
            client:
              tenantId: env:HOSTPILOT_TENANT_ID
              projectId: env:HOSTPILOT_PROJECT_ID:-
              region: cn-north-1
              hosts: ["api.example.com"]
              schema: https
              keepAlive: false

            auth:
              mode: hmac
              accessKeyId: env:HOSTPILOT_ACCESS_KEY_ID
              secretKey: env:HOSTPILOT_SECRET_KEY
              service: air

            availability:
              scoreIntervalMs: 1000
              refreshIntervalMs: 10000
              pingTimeoutMs: 300
              windowSize: 60
              failureRateThreshold: 0.1

            caller:
              keepAliveDurationMs: 60000
              pingIntervalMs: 45000
              maxConnections: 64
              defaultTimeoutMs: 5000

            metrics:
              enabled: false
              logsEnabled: false
              flushIntervalMs: 10000
              prefix: hostpilot.sdk
            """;

    private ConfigDefaults() {
    }

    /**
     * Render the default configuration template.
     */
    public static String defaultYaml() {
        return DEFAULT_YAML_TEMPLATE;
    }
}

package net.spookly.hostpilot.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;

public class HostpilotConfig {
    public ClientConfig client;
    public AuthConfig auth;
    public AvailabilityConfig availability;
    public CallerConfig caller;
    public MetricsConfig metrics;

    /**
     * Files read through {@code path:} values while loading, for permission checks.
     */
    @JsonIgnore
    public List<Path> secretFiles = new ArrayList<>();

    public static class ClientConfig {
        public String tenantId;
        public String projectId;
        /**
         * Region name; informational unless {@code auth.region} is unset.
         */
        public String region;
        public List<String> hosts;
        public String schema;
        public Boolean keepAlive;
    }

    public static class AuthConfig {
        /**
         * {@code hmac} (default) or {@code air}.
         */
        public String mode;
        public String accessKeyId;
        public String secretKey;
        public String sessionToken;
        /**
         * Credential scope region; falls back to {@code client.region}.
         */
        public String region;
        public String service;
        public String token;
    }

    public static class AvailabilityConfig {
        public Long scoreIntervalMs;
        public Long refreshIntervalMs;
        public Integer pingTimeoutMs;
        public Integer windowSize;
        public Double failureRateThreshold;
        public Integer fetchTimeoutMs;
        public Integer fetchAttempts;
    }

    public static class CallerConfig {
        public Long keepAliveDurationMs;
        public Long pingIntervalMs;
        public Integer pingTimeoutMs;
        public Integer maxConnections;
        public Integer connectTimeoutMs;
        public Integer defaultTimeoutMs;
    }

    public static class MetricsConfig {
        public Boolean enabled;
        public Boolean logsEnabled;
        public Long flushIntervalMs;
        public Integer queueCapacity;
        public Integer sendTimeoutMs;
        public Integer sendAttempts;
        public String prefix;
    }
}

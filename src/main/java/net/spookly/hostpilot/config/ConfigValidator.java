package net.spookly.hostpilot.config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class ConfigValidator {
    private ConfigValidator() {
    }

    /**
     * Validate configuration, throwing ConfigException on any violations.
     */
    public static void validate(HostpilotConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("config is required");
            throwIfErrors(errors);
            return;
        }

        validateClient(config, errors);
        validateAuth(config, errors);
        validateAvailability(config, errors);
        validateCaller(config, errors);
        validateMetrics(config, errors);

        throwIfErrors(errors);
    }

    private static void validateClient(HostpilotConfig config, List<String> errors) {
        HostpilotConfig.ClientConfig client = config.client;
        if (client == null) {
            errors.add("client section is required");
            return;
        }
        requireNonBlank(errors, client.tenantId, "client.tenantId");
        if (!isBlank(client.schema) && !isOneOf(client.schema, "http", "https")) {
            errors.add("client.schema must be one of: http, https");
        }
        validateHosts(errors, client.hosts, "client.hosts");
    }

    private static void validateAuth(HostpilotConfig config, List<String> errors) {
        HostpilotConfig.AuthConfig auth = config.auth;
        if (auth == null) {
            errors.add("auth section is required");
            return;
        }
        if (!isBlank(auth.mode) && !isOneOf(auth.mode, "hmac", "air")) {
            errors.add("auth.mode must be one of: hmac, air");
        }
        if (isAirAuth(auth)) {
            requireNonBlank(errors, auth.token, "auth.token");
            return;
        }
        requireNonBlank(errors, auth.accessKeyId, "auth.accessKeyId");
        requireNonBlank(errors, auth.secretKey, "auth.secretKey");
        String clientRegion = config.client == null ? null : config.client.region;
        if (isBlank(auth.region) && isBlank(clientRegion)) {
            errors.add("auth.region or client.region is required for hmac auth");
        }
    }

    private static void validateAvailability(HostpilotConfig config, List<String> errors) {
        HostpilotConfig.AvailabilityConfig availability = config.availability;
        if (availability == null) {
            return;
        }
        requirePositive(errors, availability.scoreIntervalMs, "availability.scoreIntervalMs");
        requirePositive(errors, availability.refreshIntervalMs, "availability.refreshIntervalMs");
        requirePositive(errors, availability.pingTimeoutMs, "availability.pingTimeoutMs");
        requirePositive(errors, availability.windowSize, "availability.windowSize");
        requirePositive(errors, availability.fetchTimeoutMs, "availability.fetchTimeoutMs");
        requirePositive(errors, availability.fetchAttempts, "availability.fetchAttempts");
        Double threshold = availability.failureRateThreshold;
        if (threshold != null && (threshold <= 0.0 || threshold > 1.0)) {
            errors.add("availability.failureRateThreshold must be in (0, 1]");
        }
    }

    private static void validateCaller(HostpilotConfig config, List<String> errors) {
        HostpilotConfig.CallerConfig caller = config.caller;
        if (caller == null) {
            return;
        }
        requirePositive(errors, caller.keepAliveDurationMs, "caller.keepAliveDurationMs");
        requirePositive(errors, caller.pingIntervalMs, "caller.pingIntervalMs");
        requirePositive(errors, caller.pingTimeoutMs, "caller.pingTimeoutMs");
        requirePositive(errors, caller.maxConnections, "caller.maxConnections");
        requirePositive(errors, caller.connectTimeoutMs, "caller.connectTimeoutMs");
        requirePositive(errors, caller.defaultTimeoutMs, "caller.defaultTimeoutMs");
    }

    private static void validateMetrics(HostpilotConfig config, List<String> errors) {
        HostpilotConfig.MetricsConfig metrics = config.metrics;
        if (metrics == null) {
            return;
        }
        requirePositive(errors, metrics.flushIntervalMs, "metrics.flushIntervalMs");
        requirePositive(errors, metrics.queueCapacity, "metrics.queueCapacity");
        requirePositive(errors, metrics.sendTimeoutMs, "metrics.sendTimeoutMs");
        requirePositive(errors, metrics.sendAttempts, "metrics.sendAttempts");
        if (metrics.prefix != null && metrics.prefix.isBlank()) {
            errors.add("metrics.prefix must not be blank");
        }
    }

    /**
     * Hosts must be present, non-blank and unique.
     */
    public static void validateHosts(List<String> errors, List<String> hosts, String field) {
        if (hosts == null || hosts.isEmpty()) {
            errors.add(field + " must contain at least one host");
            return;
        }
        Set<String> seen = new HashSet<>();
        for (String host : hosts) {
            if (isBlank(host)) {
                errors.add(field + " contains a blank host");
                continue;
            }
            if (host.contains("/")) {
                errors.add(field + " entry must be host[:port] without scheme or path: " + host);
            }
            if (!seen.add(host.trim())) {
                errors.add(field + " contains duplicate host: " + host);
            }
        }
    }

    public static boolean isAirAuth(HostpilotConfig.AuthConfig auth) {
        return auth != null && "air".equalsIgnoreCase(auth.mode);
    }

    private static void requireNonBlank(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            errors.add(field + " is required");
        }
    }

    private static void requirePositive(List<String> errors, Number value, String field) {
        if (value != null && value.doubleValue() <= 0) {
            errors.add(field + " must be > 0");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static boolean isOneOf(String value, String... options) {
        if (value == null) {
            return false;
        }
        for (String option : options) {
            if (value.equalsIgnoreCase(option)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Report every collected problem at once as a single ConfigException.
     */
    public static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            StringBuilder builder = new StringBuilder("Invalid config:\n");
            for (String error : errors) {
                builder.append("- ").append(error).append('\n');
            }
            throw new ConfigException(builder.toString());
        }
    }
}

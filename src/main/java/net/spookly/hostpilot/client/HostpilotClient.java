package net.spookly.hostpilot.client;

import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.spookly.hostpilot.auth.AirAuthSigner;
import net.spookly.hostpilot.auth.Credential;
import net.spookly.hostpilot.auth.HmacRequestSigner;
import net.spookly.hostpilot.auth.RequestSigner;
import net.spookly.hostpilot.availability.AvailabilitySettings;
import net.spookly.hostpilot.availability.HostAvailabilityManager;
import net.spookly.hostpilot.availability.HostConfigFetcher;
import net.spookly.hostpilot.availability.HostResolver;
import net.spookly.hostpilot.availability.HostScorer;
import net.spookly.hostpilot.availability.HttpHostConfigFetcher;
import net.spookly.hostpilot.availability.HttpPingProbe;
import net.spookly.hostpilot.availability.PingHostScorer;
import net.spookly.hostpilot.caller.CallException;
import net.spookly.hostpilot.caller.CallOptions;
import net.spookly.hostpilot.caller.CallerConfig;
import net.spookly.hostpilot.caller.HeartbeatService;
import net.spookly.hostpilot.caller.HttpCaller;
import net.spookly.hostpilot.caller.TransportFactory;
import net.spookly.hostpilot.config.ConfigException;
import net.spookly.hostpilot.config.ConfigValidator;
import net.spookly.hostpilot.config.HostpilotConfig;
import net.spookly.hostpilot.metrics.HttpMetricsSender;
import net.spookly.hostpilot.metrics.MetricsCollector;
import net.spookly.hostpilot.metrics.MetricsSender;
import net.spookly.hostpilot.metrics.MetricsSettings;
import net.spookly.hostpilot.util.CancellationToken;
import net.spookly.hostpilot.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: signed calls against the best available host, plus the background loops that
 * keep the host ranking, keep-alive and metrics going.
 *
 * <p>All loops share one {@link CancellationToken}; {@link #shutdown()} cancels it.
 */
public final class HostpilotClient implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(HostpilotClient.class);

    private final HttpCaller caller;
    private final HostAvailabilityManager availability;
    private final MetricsCollector metrics;
    private final HeartbeatService heartbeat;
    private final CancellationToken token;
    private final ExecutorService executor;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private HostpilotClient(HttpCaller caller,
                            HostAvailabilityManager availability,
                            MetricsCollector metrics,
                            HeartbeatService heartbeat,
                            CancellationToken token,
                            ExecutorService executor) {
        this.caller = caller;
        this.availability = availability;
        this.metrics = metrics;
        this.heartbeat = heartbeat;
        this.token = token;
        this.executor = executor;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-filled from a loaded configuration file.
     */
    public static Builder builder(HostpilotConfig config) {
        return new Builder().fromConfig(config);
    }

    public <T> T call(String path, Object request, Class<T> responseType, CallOptions options) throws CallException {
        return caller.call(path, request, responseType, options);
    }

    public byte[] callRaw(String path, byte[] body, String contentType, CallOptions options) throws CallException {
        return caller.callRaw(path, body, contentType, options);
    }

    public String getHost(String path) {
        return availability.getHost(path);
    }

    public List<String> getHosts() {
        return availability.getHosts();
    }

    public HostAvailabilityManager availability() {
        return availability;
    }

    public MetricsCollector metrics() {
        return metrics;
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * Stop every background loop and release pooled connections. Idempotent.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        token.cancel();
        if (heartbeat != null) {
            heartbeat.stop();
        }
        availability.shutdown();
        metrics.shutdown();
        if (executor != null) {
            executor.shutdown();
        }
        LOGGER.debug("Client shut down");
    }

    @Override
    public void close() {
        shutdown();
    }

    public static final class Builder {
        private String tenantId;
        private String projectId;
        private String accessKeyId;
        private String secretKey;
        private String sessionToken;
        private String authService = "air";
        private String credentialRegion;
        private boolean useAirAuth;
        private String airAuthToken;
        private Region region;
        private List<String> hosts;
        private String schema = "https";
        private boolean keepAlive;
        private CallerConfig callerConfig = CallerConfig.defaults();
        private AvailabilitySettings availabilitySettings = AvailabilitySettings.defaults();
        private MetricsSettings metricsSettings = MetricsSettings.defaults();
        private HttpClient httpClient;
        private HostScorer hostScorer;
        private HostConfigFetcher hostConfigFetcher;
        private MetricsSender metricsSender;
        private ObjectMapper objectMapper;

        private Builder() {
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        /**
         * Enables the remote host refresh loop.
         */
        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder accessKey(String accessKeyId, String secretKey) {
            this.accessKeyId = accessKeyId;
            this.secretKey = secretKey;
            return this;
        }

        public Builder sessionToken(String sessionToken) {
            this.sessionToken = sessionToken;
            return this;
        }

        public Builder authService(String authService) {
            this.authService = authService;
            return this;
        }

        public Builder credentialRegion(String credentialRegion) {
            this.credentialRegion = credentialRegion;
            return this;
        }

        /**
         * Switch to token auth instead of HMAC request signing.
         */
        public Builder airAuth(String token) {
            this.useAirAuth = true;
            this.airAuthToken = token;
            return this;
        }

        public Builder region(Region region) {
            this.region = region;
            return this;
        }

        /**
         * Explicit default hosts; take precedence over the region's hosts.
         */
        public Builder hosts(List<String> hosts) {
            this.hosts = hosts == null ? null : new ArrayList<>(hosts);
            return this;
        }

        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        public Builder keepAlive(boolean keepAlive) {
            this.keepAlive = keepAlive;
            return this;
        }

        public Builder callerConfig(CallerConfig callerConfig) {
            this.callerConfig = callerConfig;
            return this;
        }

        public Builder availabilitySettings(AvailabilitySettings availabilitySettings) {
            this.availabilitySettings = availabilitySettings;
            return this;
        }

        public Builder metricsSettings(MetricsSettings metricsSettings) {
            this.metricsSettings = metricsSettings;
            return this;
        }

        /**
         * Shared transport; when unset the client creates and owns one.
         */
        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder hostScorer(HostScorer hostScorer) {
            this.hostScorer = hostScorer;
            return this;
        }

        public Builder hostConfigFetcher(HostConfigFetcher hostConfigFetcher) {
            this.hostConfigFetcher = hostConfigFetcher;
            return this;
        }

        public Builder metricsSender(MetricsSender metricsSender) {
            this.metricsSender = metricsSender;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        Builder fromConfig(HostpilotConfig config) {
            ConfigValidator.validate(config);
            HostpilotConfig.ClientConfig client = config.client;
            tenantId(client.tenantId);
            projectId(client.projectId);
            hosts(client.hosts);
            if (!Strings.isBlank(client.schema)) {
                schema(client.schema);
            }
            keepAlive(Boolean.TRUE.equals(client.keepAlive));

            HostpilotConfig.AuthConfig auth = config.auth;
            if (ConfigValidator.isAirAuth(auth)) {
                airAuth(auth.token);
            } else {
                accessKey(auth.accessKeyId, auth.secretKey);
                sessionToken(auth.sessionToken);
            }
            credentialRegion(Strings.isBlank(auth.region) ? client.region : auth.region);
            if (!Strings.isBlank(auth.service)) {
                authService(auth.service);
            }

            HostpilotConfig.AvailabilityConfig a = config.availability;
            if (a != null) {
                AvailabilitySettings s = availabilitySettings;
                s = a.scoreIntervalMs == null ? s : s.withScoreIntervalMs(a.scoreIntervalMs);
                s = a.refreshIntervalMs == null ? s : s.withRefreshIntervalMs(a.refreshIntervalMs);
                s = a.pingTimeoutMs == null ? s : s.withPingTimeoutMs(a.pingTimeoutMs);
                s = a.windowSize == null ? s : s.withWindowSize(a.windowSize);
                s = a.failureRateThreshold == null ? s : s.withFailureRateThreshold(a.failureRateThreshold);
                s = a.fetchTimeoutMs == null ? s : s.withFetchTimeoutMs(a.fetchTimeoutMs);
                s = a.fetchAttempts == null ? s : s.withFetchAttempts(a.fetchAttempts);
                availabilitySettings(s);
            }

            HostpilotConfig.CallerConfig c = config.caller;
            if (c != null) {
                CallerConfig s = callerConfig;
                s = c.keepAliveDurationMs == null ? s : s.withKeepAliveDurationMs(c.keepAliveDurationMs);
                s = c.pingIntervalMs == null ? s : s.withPingIntervalMs(c.pingIntervalMs);
                s = c.pingTimeoutMs == null ? s : s.withPingTimeoutMs(c.pingTimeoutMs);
                s = c.maxConnections == null ? s : s.withMaxConnections(c.maxConnections);
                s = c.connectTimeoutMs == null ? s : s.withConnectTimeoutMs(c.connectTimeoutMs);
                s = c.defaultTimeoutMs == null ? s : s.withDefaultTimeoutMs(c.defaultTimeoutMs);
                callerConfig(s);
            }

            HostpilotConfig.MetricsConfig m = config.metrics;
            if (m != null) {
                MetricsSettings s = metricsSettings;
                s = m.enabled == null ? s : s.withEnabled(m.enabled);
                s = m.logsEnabled == null ? s : s.withLogsEnabled(m.logsEnabled);
                s = m.flushIntervalMs == null ? s : s.withFlushIntervalMs(m.flushIntervalMs);
                s = m.queueCapacity == null ? s : s.withQueueCapacity(m.queueCapacity);
                s = m.sendTimeoutMs == null ? s : s.withSendTimeoutMs(m.sendTimeoutMs);
                s = m.sendAttempts == null ? s : s.withSendAttempts(m.sendAttempts);
                s = m.prefix == null ? s : s.withPrefix(m.prefix);
                metricsSettings(s);
            }
            return this;
        }

        /**
         * Validate the settings, wire every component and start the background loops.
         * Never blocks on network I/O.
         *
         * @throws ConfigException when required settings are missing or invalid
         */
        public HostpilotClient build() {
            List<String> defaultHosts = resolveHosts();
            validate(defaultHosts);

            CancellationToken token = new CancellationToken();
            CallerConfig effectiveCaller = callerConfig == null ? CallerConfig.defaults() : callerConfig.withDefaults();
            AvailabilitySettings effectiveAvailability =
                    availabilitySettings == null ? AvailabilitySettings.defaults() : availabilitySettings;
            ExecutorService executor = null;
            HttpClient transport = httpClient;
            if (transport == null) {
                executor = TransportFactory.newExecutor("hostpilot-http");
                transport = TransportFactory.newHttpClient(effectiveCaller, executor);
            }
            ObjectMapper mapper = objectMapper == null ? new ObjectMapper() : objectMapper;
            try {
                // Metrics ship through the availability manager, which in turn reports probe results to metrics.
                AtomicReference<HostAvailabilityManager> managerRef = new AtomicReference<>();
                MetricsCollector metrics = newMetrics(transport, mapper, token,
                        path -> managerRef.get().getHost(path));

                HttpPingProbe probe = new HttpPingProbe(transport, schema, projectId, metrics);
                HostScorer scorer = hostScorer != null
                        ? hostScorer
                        : new PingHostScorer(probe, effectiveAvailability.windowSize(), effectiveAvailability.pingTimeoutMs());
                HostConfigFetcher fetcher = hostConfigFetcher;
                if (fetcher == null && !Strings.isBlank(projectId)) {
                    fetcher = new HttpHostConfigFetcher(transport,
                            effectiveAvailability.fetchTimeoutMs(), effectiveAvailability.fetchAttempts());
                }
                HostAvailabilityManager manager = new HostAvailabilityManager(
                        defaultHosts, projectId, scorer, fetcher, effectiveAvailability, token);
                managerRef.set(manager);

                HttpCaller caller = new HttpCaller(transport, manager, newSigner(), metrics, effectiveCaller,
                        schema, tenantId, projectId, mapper);
                HeartbeatService heartbeat = keepAlive
                        ? new HeartbeatService(probe, manager::getHosts, metrics, projectId, effectiveCaller, token)
                        : null;

                manager.start();
                metrics.start();
                if (heartbeat != null) {
                    heartbeat.start();
                }
                LOGGER.debug("Client built, hosts={} projectId={} keepAlive={}", defaultHosts, projectId, keepAlive);
                return new HostpilotClient(caller, manager, metrics, heartbeat, token, executor);
            } catch (RuntimeException e) {
                token.cancel();
                if (executor != null) {
                    executor.shutdown();
                }
                throw e;
            }
        }

        private List<String> resolveHosts() {
            if (hosts != null && !hosts.isEmpty()) {
                return hosts;
            }
            if (region != null) {
                return region.hosts();
            }
            return List.of();
        }

        private String resolveCredentialRegion() {
            if (!Strings.isBlank(credentialRegion)) {
                return credentialRegion;
            }
            return region == null ? null : region.credentialRegion();
        }

        private void validate(List<String> defaultHosts) {
            List<String> errors = new ArrayList<>();
            if (Strings.isBlank(tenantId)) {
                errors.add("tenant id is required");
            }
            if (useAirAuth) {
                if (Strings.isBlank(airAuthToken)) {
                    errors.add("air auth token is required");
                }
            } else {
                if (Strings.isBlank(accessKeyId) || Strings.isBlank(secretKey)) {
                    errors.add("access key id and secret key are required");
                }
                if (Strings.isBlank(resolveCredentialRegion())) {
                    errors.add("region is required");
                }
            }
            if (!Strings.isBlank(schema) && !schema.equals("http") && !schema.equals("https")) {
                errors.add("schema must be http or https");
            }
            ConfigValidator.validateHosts(errors, defaultHosts, "hosts");
            ConfigValidator.throwIfErrors(errors);
        }

        private RequestSigner newSigner() {
            if (useAirAuth) {
                return new AirAuthSigner(airAuthToken, tenantId);
            }
            return new HmacRequestSigner(new Credential(accessKeyId, secretKey, resolveCredentialRegion(),
                    Strings.isBlank(authService) ? "air" : authService, sessionToken));
        }

        private MetricsCollector newMetrics(HttpClient transport,
                                            ObjectMapper mapper,
                                            CancellationToken token,
                                            HostResolver resolver) {
            MetricsSettings settings = metricsSettings == null ? MetricsSettings.defaults() : metricsSettings;
            if (!settings.enabled()) {
                return new MetricsCollector(settings, null, token);
            }
            MetricsSender sender = metricsSender != null
                    ? metricsSender
                    : new HttpMetricsSender(transport, resolver, schema, mapper,
                    settings.sendTimeoutMs(), settings.sendAttempts());
            return new MetricsCollector(settings, sender, token);
        }
    }
}

package net.spookly.hostpilot.availability;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import net.spookly.hostpilot.metrics.MetricsCollector;
import net.spookly.hostpilot.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP health probe hitting the service ping endpoint.
 *
 * <p>A host is healthy when it answers 200 with a short body containing {@code pong}.
 */
public final class HttpPingProbe implements HealthProbe {
    public static final String DEFAULT_PING_PATH = "/predict/api/ping";

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpPingProbe.class);
    private static final String PONG = "pong";
    private static final int MAX_PONG_BODY_BYTES = 20;

    private final HttpClient httpClient;
    private final String schema;
    private final String pingPath;
    private final String projectId;
    private final MetricsCollector metrics;

    public HttpPingProbe(HttpClient httpClient, String schema, String projectId, MetricsCollector metrics) {
        this(httpClient, schema, DEFAULT_PING_PATH, projectId, metrics);
    }

    public HttpPingProbe(HttpClient httpClient,
                         String schema,
                         String pingPath,
                         String projectId,
                         MetricsCollector metrics) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.schema = Strings.isBlank(schema) ? "https" : schema;
        this.pingPath = Strings.isBlank(pingPath) ? DEFAULT_PING_PATH : pingPath;
        this.projectId = projectId;
        this.metrics = metrics == null ? MetricsCollector.disabled() : metrics;
    }

    @Override
    public CompletableFuture<Boolean> probe(String host, int timeoutMs) {
        Objects.requireNonNull(host, "host");
        String requestId = "ping_" + UUID.randomUUID();
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(pingUrl(host)))
                .header("Request-Id", requestId)
                .GET();
        if (!Strings.isBlank(projectId)) {
            builder.header("Project-Id", projectId);
        }
        if (timeoutMs > 0) {
            builder.timeout(Duration.ofMillis(timeoutMs));
        }
        long start = System.nanoTime();
        return httpClient.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofByteArray())
                .handle((response, error) -> {
                    long costMs = (System.nanoTime() - start) / 1_000_000L;
                    if (error != null) {
                        LOGGER.warn("Ping failed, host={} cost={}ms error={}", host, costMs, error.toString());
                        metrics.warn(requestId, String.format("ping failed, project_id:%s, host:%s, cost:%dms, err:%s",
                                projectId, host, costMs, error));
                        return false;
                    }
                    if (isPingSuccess(response.statusCode(), response.body())) {
                        LOGGER.debug("Ping succeeded, host={} cost={}ms", host, costMs);
                        metrics.info(requestId, String.format("ping success, project_id:%s, host:%s, cost:%dms",
                                projectId, host, costMs));
                        return true;
                    }
                    LOGGER.warn("Ping failed, host={} cost={}ms status={}", host, costMs, response.statusCode());
                    metrics.warn(requestId, String.format("ping failed, project_id:%s, host:%s, cost:%dms, status:%d",
                            projectId, host, costMs, response.statusCode()));
                    return false;
                });
    }

    String pingUrl(String host) {
        String path = pingPath.startsWith("/") ? pingPath : "/" + pingPath;
        return schema + "://" + host + path;
    }

    static boolean isPingSuccess(int statusCode, byte[] body) {
        if (statusCode != 200 || body == null || body.length == 0) {
            return false;
        }
        if (body.length >= MAX_PONG_BODY_BYTES) {
            return false;
        }
        return new String(body, StandardCharsets.UTF_8).contains(PONG);
    }
}

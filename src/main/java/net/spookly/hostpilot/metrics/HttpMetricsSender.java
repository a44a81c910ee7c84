package net.spookly.hostpilot.metrics;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.spookly.hostpilot.availability.HostResolver;
import net.spookly.hostpilot.util.Strings;

/**
 * Posts JSON batches to the reporting host chosen by a {@link HostResolver}.
 *
 * <p>Only timeouts are retried; any other failure ends the attempt at once.
 */
public final class HttpMetricsSender implements MetricsSender {
    private final HttpClient httpClient;
    private final HostResolver hostResolver;
    private final String schema;
    private final ObjectMapper mapper;
    private final int sendTimeoutMs;
    private final int maxAttempts;

    public HttpMetricsSender(HttpClient httpClient,
                             HostResolver hostResolver,
                             String schema,
                             ObjectMapper mapper,
                             int sendTimeoutMs,
                             int maxAttempts) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.hostResolver = Objects.requireNonNull(hostResolver, "hostResolver");
        this.schema = Strings.isBlank(schema) ? "https" : schema;
        this.mapper = mapper == null ? new ObjectMapper() : mapper;
        this.sendTimeoutMs = sendTimeoutMs;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    @Override
    public void sendMetrics(String path, List<MetricEvent> batch) throws IOException {
        post(path, mapper.writeValueAsBytes(Collections.singletonMap("metrics", batch)));
    }

    @Override
    public void sendLogs(List<LogEvent> batch) throws IOException {
        post(LOG_PATH, mapper.writeValueAsBytes(Collections.singletonMap("logs", batch)));
    }

    private void post(String path, byte[] body) throws IOException {
        String url = schema + "://" + hostResolver.getHost(path) + path;
        IOException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                sendOnce(url, body);
                return;
            } catch (IOException e) {
                last = e;
                if (!isTimeout(e)) {
                    throw e;
                }
            }
        }
        throw last;
    }

    private void sendOnce(String url, byte[] body) throws IOException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body));
        if (sendTimeoutMs > 0) {
            builder.timeout(Duration.ofMillis(sendTimeoutMs));
        }
        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted while sending metrics to " + url, e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new IOException("metrics endpoint " + url + " answered " + response.statusCode()
                    + ": " + response.body());
        }
    }

    static boolean isTimeout(IOException e) {
        if (e instanceof HttpTimeoutException) {
            return true;
        }
        String message = e.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains("timeout");
    }
}

package net.spookly.hostpilot.availability;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches host config over {@code GET http://<host>/data/api/sdk/host?project_id=<id>}.
 *
 * <p>Transport failures and non-2xx statuses are retried; 404 and undecodable bodies are final.
 */
public final class HttpHostConfigFetcher implements HostConfigFetcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpHostConfigFetcher.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, List<String>>> HOST_CONFIG_TYPE = new TypeReference<>() {
    };
    private static final String FETCH_PATH = "/data/api/sdk/host";

    private final HttpClient httpClient;
    private final int timeoutMs;
    private final int maxAttempts;

    public HttpHostConfigFetcher(HttpClient httpClient, int timeoutMs, int maxAttempts) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.timeoutMs = timeoutMs;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    @Override
    public FetchResult fetch(String host, String projectId) {
        String url = fetchUrl(host, projectId);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            FetchResult result = fetchOnce(url);
            if (result.status() != FetchResult.Status.FAILED) {
                return result;
            }
        }
        LOGGER.warn("Fetching hosts from server failed after {} attempts, url={}", maxAttempts, url);
        return FetchResult.failed();
    }

    static String fetchUrl(String host, String projectId) {
        return "http://" + host + FETCH_PATH + "?project_id=" + URLEncoder.encode(projectId, StandardCharsets.UTF_8);
    }

    private FetchResult fetchOnce(String url) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofMillis(timeoutMs))
                .GET()
                .build();
        long start = System.nanoTime();
        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            LOGGER.warn("Fetching hosts from server failed, url={} cost={}ms error={}", url, costMs(start), e.toString());
            return FetchResult.failed();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Fetching hosts from server interrupted, url={}", url);
            return FetchResult.failed();
        }
        int status = response.statusCode();
        if (status == 404) {
            LOGGER.warn("Host server has no config for this project, url={} cost={}ms", url, costMs(start));
            return FetchResult.notFound();
        }
        if (status < 200 || status >= 300) {
            LOGGER.warn("Host server returned status {}, url={} cost={}ms", status, url, costMs(start));
            return FetchResult.failed();
        }
        byte[] body = response.body();
        LOGGER.debug("Fetched hosts from server, url={} cost={}ms", url, costMs(start));
        if (body == null || body.length == 0) {
            LOGGER.warn("Host server returned an empty body, url={}", url);
            return FetchResult.invalid();
        }
        try {
            Map<String, List<String>> hosts = MAPPER.readValue(body, HOST_CONFIG_TYPE);
            return hosts == null ? FetchResult.invalid() : FetchResult.ok(hosts);
        } catch (IOException e) {
            LOGGER.warn("Failed to decode host config, url={} error={}", url, e.getMessage());
            return FetchResult.invalid();
        }
    }

    private static long costMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}

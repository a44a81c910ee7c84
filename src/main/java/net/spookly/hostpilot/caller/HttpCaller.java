package net.spookly.hostpilot.caller;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.spookly.hostpilot.auth.RequestSigner;
import net.spookly.hostpilot.auth.SignableRequest;
import net.spookly.hostpilot.availability.HostResolver;
import net.spookly.hostpilot.metrics.MetricsCollector;
import net.spookly.hostpilot.metrics.MetricsKeys;
import net.spookly.hostpilot.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes signed, gzip-compressed POST calls against the best host for a path.
 *
 * <p>Every outcome is classified: {@link CallTimeoutException}, {@link NetException},
 * {@link StatusException} or {@link EncodingException}. Raw transport errors never escape.
 */
public final class HttpCaller {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpCaller.class);
    private static final String JSON = "application/json";
    private static final Set<String> RESTRICTED_HEADERS = Set.of("host", "content-length", "connection", "expect", "upgrade");

    private final HttpClient httpClient;
    private final HostResolver hostResolver;
    private final RequestSigner signer;
    private final MetricsCollector metrics;
    private final CallerConfig config;
    private final String schema;
    private final String tenantId;
    private final String projectId;
    private final ObjectMapper mapper;
    private final UrlBuilder urlBuilder;
    private final Semaphore permits;

    public HttpCaller(HttpClient httpClient,
                      HostResolver hostResolver,
                      RequestSigner signer,
                      MetricsCollector metrics,
                      CallerConfig config,
                      String schema,
                      String tenantId,
                      String projectId,
                      ObjectMapper mapper) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.hostResolver = Objects.requireNonNull(hostResolver, "hostResolver");
        this.signer = Objects.requireNonNull(signer, "signer");
        this.metrics = metrics == null ? MetricsCollector.disabled() : metrics;
        this.config = config == null ? CallerConfig.defaults() : config.withDefaults();
        this.schema = Strings.isBlank(schema) ? "https" : schema;
        this.tenantId = tenantId;
        this.projectId = projectId == null ? "" : projectId;
        this.mapper = mapper == null ? new ObjectMapper() : mapper;
        this.urlBuilder = new UrlBuilder(this.schema);
        this.permits = new Semaphore(this.config.maxConnections(), true);
    }

    /**
     * JSON call: {@code request} is serialized with Jackson, the response is bound to
     * {@code responseType}.
     */
    public <T> T call(String path, Object request, Class<T> responseType, CallOptions options)
            throws CallException {
        CallOptions effective = options == null ? CallOptions.create() : options;
        String requestId = resolveRequestId(effective);
        String host = hostResolver.getHost(path);
        String url = urlBuilder.url(host, path);
        byte[] payload;
        try {
            payload = mapper.writeValueAsBytes(request);
        } catch (IOException e) {
            reportError("marshal_json_request_fail", requestId, url, null, e.getMessage());
            throw new EncodingException("marshal json request failed: " + e.getMessage(), requestId, e);
        }
        byte[] body = execute(path, host, url, payload, JSON, effective, requestId);
        try {
            return mapper.readValue(body, responseType);
        } catch (IOException e) {
            reportError("unmarshal_json_response_fail", requestId, url, null, e.getMessage());
            throw new EncodingException("unmarshal json response failed: " + e.getMessage(), requestId, e);
        }
    }

    /**
     * Raw call for payloads the caller has already encoded, e.g. protobuf.
     */
    public byte[] callRaw(String path, byte[] body, String contentType, CallOptions options) throws CallException {
        CallOptions effective = options == null ? CallOptions.create() : options;
        String requestId = resolveRequestId(effective);
        String host = hostResolver.getHost(path);
        return execute(path, host, urlBuilder.url(host, path), body == null ? new byte[0] : body,
                Strings.isBlank(contentType) ? "application/octet-stream" : contentType, effective, requestId);
    }

    private byte[] execute(String path, String host, String url, byte[] payload, String contentType,
                           CallOptions options, String requestId) throws CallException {
        byte[] compressed;
        try {
            compressed = GzipCodec.compress(payload);
        } catch (IOException e) {
            throw new EncodingException("gzip request failed: " + e.getMessage(), requestId, e);
        }

        SignableRequest request = new SignableRequest("POST", schema, host, UrlBuilder.normalizePath(path), compressed);
        for (Map.Entry<String, String> header : buildHeaders(contentType, options, requestId).entrySet()) {
            request.setHeader(header.getKey(), header.getValue());
        }
        for (Map.Entry<String, String> query : options.queryParams().entrySet()) {
            request.addQueryParam(query.getKey(), query.getValue());
        }
        signer.sign(request);

        long timeoutMs = options.timeout() != null && !options.timeout().isNegative() && !options.timeout().isZero()
                ? options.timeout().toMillis()
                : config.defaultTimeoutMs();

        long start = System.nanoTime();
        HttpResponse<byte[]> response;
        try {
            response = send(request, compressed, start, timeoutMs, requestId, url);
        } finally {
            long costMs = (System.nanoTime() - start) / 1_000_000L;
            Map<String, String> tags = tags(url);
            metrics.timer(MetricsKeys.REQUEST_TOTAL_COST, costMs, tags);
            metrics.counter(MetricsKeys.REQUEST_COUNT, 1, tags);
            metrics.info(requestId, String.format("http request project_id:%s, url:%s, cost:%dms", projectId, url, costMs));
            LOGGER.debug("http url={} cost={}ms", url, costMs);
        }

        String contentEncoding = response.headers().firstValue("Content-Encoding").orElse("");
        if (response.statusCode() != 200) {
            String errorBody = decodeQuietly(contentEncoding, response.body(), requestId);
            Map<String, String> tags = tags(url);
            tags.put(MetricsKeys.TAG_STATUS, Integer.toString(response.statusCode()));
            reportError("rsp_status_not_ok", requestId, url, tags,
                    "code:" + response.statusCode() + ", body:" + errorBody);
            throw new StatusException("http status not 200: " + response.statusCode(), requestId,
                    response.statusCode(), errorBody);
        }
        try {
            return GzipCodec.decode(contentEncoding, response.body(), requestId);
        } catch (EncodingException e) {
            LOGGER.error("Decoding response failed, url={} requestId={}: {}", url, requestId, e.getMessage());
            throw e;
        }
    }

    /**
     * Waits for a connection permit and sends the request. Both share one deadline, so the
     * exchange is bounded by {@code timeoutMs} measured from {@code startNanos}.
     */
    private HttpResponse<byte[]> send(SignableRequest request, byte[] body, long startNanos, long timeoutMs,
                                      String requestId, String url) throws CallException {
        long deadlineNanos = startNanos + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        boolean acquired;
        try {
            acquired = permits.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetException("interrupted while waiting for a connection", requestId, e);
        }
        if (!acquired) {
            reportError("request_timeout", requestId, url, null, "no free connection within " + timeoutMs + "ms");
            throw new CallTimeoutException("timeout waiting for a free connection", requestId, null);
        }
        try {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
            if (remainingMs <= 0) {
                reportError("request_timeout", requestId, url, null, "no time left after waiting for a connection");
                throw new CallTimeoutException("timeout waiting for a free connection", requestId, null);
            }
            return httpClient.send(toHttpRequest(request, body, remainingMs), HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            if (isTimeout(e)) {
                reportError("request_timeout", requestId, url, null, e.toString());
                throw new CallTimeoutException("timeout", requestId, e);
            }
            reportError("request_occur_err", requestId, url, null, e.toString());
            throw new NetException(e.toString(), requestId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetException("interrupted during http request", requestId, e);
        } finally {
            permits.release();
        }
    }

    private static HttpRequest toHttpRequest(SignableRequest request, byte[] body, long timeoutMs) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(request.toUri())
                .timeout(Duration.ofMillis(timeoutMs))
                .POST(HttpRequest.BodyPublishers.ofByteArray(body));
        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            if (!RESTRICTED_HEADERS.contains(header.getKey().toLowerCase(Locale.ROOT))) {
                builder.header(header.getKey(), header.getValue());
            }
        }
        return builder.build();
    }

    Map<String, String> buildHeaders(String contentType, CallOptions options, String requestId) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Encoding", GzipCodec.GZIP);
        headers.put("Accept-Encoding", GzipCodec.GZIP);
        headers.put("Content-Type", contentType);
        headers.put("Accept", contentType);
        if (!Strings.isBlank(tenantId)) {
            headers.put("Tenant-Id", tenantId);
        }
        if (!Strings.isBlank(projectId)) {
            headers.put("Project-Id", projectId);
        }
        headers.put("Request-Id", requestId);
        Duration serverTimeout = options.serverTimeout();
        if (serverTimeout != null && serverTimeout.toMillis() > 0) {
            headers.put("Timeout-Millis", Long.toString(serverTimeout.toMillis()));
        }
        headers.putAll(options.headers());
        return headers;
    }

    int availableConnections() {
        return permits.availablePermits();
    }

    private String resolveRequestId(CallOptions options) {
        if (!Strings.isBlank(options.requestId())) {
            return options.requestId();
        }
        String generated = UUID.randomUUID().toString();
        LOGGER.info("requestId is generated by sdk: '{}'", generated);
        options.requestId(generated);
        return generated;
    }

    private void reportError(String type, String requestId, String url, Map<String, String> baseTags, String detail) {
        Map<String, String> tags = baseTags == null ? tags(url) : baseTags;
        tags.put(MetricsKeys.TAG_TYPE, type);
        metrics.counter(MetricsKeys.COMMON_ERROR, 1, tags);
        metrics.error(requestId, String.format("%s, project_id:%s, url:%s, %s", type, projectId, url, detail));
        LOGGER.error("{} url={} requestId={} {}", type, url, requestId, detail);
    }

    private Map<String, String> tags(String url) {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put(MetricsKeys.TAG_PROJECT_ID, projectId);
        tags.put(MetricsKeys.TAG_URL, url);
        return tags;
    }

    private static String decodeQuietly(String contentEncoding, byte[] body, String requestId) {
        if (body == null || body.length == 0) {
            return "";
        }
        try {
            return new String(GzipCodec.decode(contentEncoding, body, requestId), StandardCharsets.UTF_8);
        } catch (EncodingException e) {
            return new String(body, StandardCharsets.UTF_8);
        }
    }

    static boolean isTimeout(Throwable error) {
        if (error instanceof HttpTimeoutException) {
            return true;
        }
        String message = error.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains("timeout");
    }
}

package net.spookly.hostpilot.caller;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.http.HttpClient;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import net.spookly.hostpilot.metrics.LogEvent;
import net.spookly.hostpilot.metrics.MetricEvent;
import net.spookly.hostpilot.metrics.MetricsCollector;
import net.spookly.hostpilot.metrics.MetricsSender;
import net.spookly.hostpilot.metrics.MetricsSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpCallerTest {
    private HttpServer server;
    private ExecutorService serverExecutor;
    private final AtomicReference<Headers> seenHeaders = new AtomicReference<>();
    private final AtomicReference<byte[]> seenBody = new AtomicReference<>();
    private final AtomicReference<String> seenQuery = new AtomicReference<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        serverExecutor = Executors.newCachedThreadPool();
        server.setExecutor(serverExecutor);
        server.createContext("/echo", exchange -> {
            byte[] request = GzipCodec.decompress(exchange.getRequestBody().readAllBytes());
            record(exchange, request);
            exchange.getResponseHeaders().add("Content-Encoding", "gzip");
            respond(exchange, 200, GzipCodec.compress(request));
        });
        server.createContext("/plain", exchange -> {
            record(exchange, GzipCodec.decompress(exchange.getRequestBody().readAllBytes()));
            respond(exchange, 200, "{\"plain\":true}".getBytes(StandardCharsets.UTF_8));
        });
        server.createContext("/fail", exchange -> {
            exchange.getRequestBody().readAllBytes();
            respond(exchange, 500, "boom".getBytes(StandardCharsets.UTF_8));
        });
        server.createContext("/brotli", exchange -> {
            exchange.getRequestBody().readAllBytes();
            exchange.getResponseHeaders().add("Content-Encoding", "br");
            respond(exchange, 200, new byte[]{1, 2, 3});
        });
        server.createContext("/garbage", exchange -> {
            exchange.getRequestBody().readAllBytes();
            respond(exchange, 200, "not json".getBytes(StandardCharsets.UTF_8));
        });
        server.createContext("/slow", exchange -> {
            exchange.getRequestBody().readAllBytes();
            try {
                Thread.sleep(1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, new byte[0]);
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
        serverExecutor.shutdownNow();
    }

    @Test
    void jsonCallIsCompressedSignedAndDecoded() throws Exception {
        HttpCaller caller = caller(host(), MetricsCollector.disabled());
        CallOptions options = CallOptions.create()
                .requestId("req-1")
                .serverTimeout(Duration.ofMillis(800))
                .header("X-Custom", "yes")
                .query("q", "a b");

        Map<?, ?> response = caller.call("/echo", Map.of("value", "hi"), Map.class, options);

        assertEquals("hi", response.get("value"));
        assertEquals("{\"value\":\"hi\"}", new String(seenBody.get(), StandardCharsets.UTF_8));
        Headers headers = seenHeaders.get();
        assertEquals("gzip", headers.getFirst("Content-Encoding"));
        assertEquals("gzip", headers.getFirst("Accept-Encoding"));
        assertEquals("application/json", headers.getFirst("Content-Type"));
        assertEquals("tenant-1", headers.getFirst("Tenant-Id"));
        assertEquals("project-1", headers.getFirst("Project-Id"));
        assertEquals("req-1", headers.getFirst("Request-Id"));
        assertEquals("800", headers.getFirst("Timeout-Millis"));
        assertEquals("yes", headers.getFirst("X-Custom"));
        assertEquals("1", headers.getFirst("X-Signed"));
        assertEquals("q=a%20b", seenQuery.get());
    }

    @Test
    void rawCallPassesBytesAndAcceptsUncompressedResponses() throws Exception {
        HttpCaller caller = caller(host(), MetricsCollector.disabled());
        byte[] payload = new byte[]{0, 1, 2, 3};

        byte[] response = caller.callRaw("plain", payload, "application/x-protobuf", CallOptions.create());

        assertEquals("{\"plain\":true}", new String(response, StandardCharsets.UTF_8));
        assertArrayEquals(payload, seenBody.get());
        assertEquals("application/x-protobuf", seenHeaders.get().getFirst("Content-Type"));
    }

    @Test
    void missingRequestIdIsGenerated() throws Exception {
        HttpCaller caller = caller(host(), MetricsCollector.disabled());
        CallOptions options = CallOptions.create();

        caller.callRaw("/echo", new byte[0], null, options);

        assertNotNull(options.requestId());
        assertEquals(options.requestId(), seenHeaders.get().getFirst("Request-Id"));
    }

    @Test
    void nonOkStatusCarriesCodeAndBody() {
        HttpCaller caller = caller(host(), MetricsCollector.disabled());

        StatusException error = assertThrows(StatusException.class,
                () -> caller.callRaw("/fail", new byte[0], null, CallOptions.create().requestId("r")));

        assertEquals(500, error.statusCode());
        assertEquals("boom", error.body());
        assertEquals("r", error.requestId());
        assertFalse(NetException.isNetError(error));
    }

    @Test
    void slowServerEndsInTimeout() {
        HttpCaller caller = caller(host(), MetricsCollector.disabled());

        CallTimeoutException error = assertThrows(CallTimeoutException.class,
                () -> caller.callRaw("/slow", new byte[0], null,
                        CallOptions.create().timeout(Duration.ofMillis(150))));

        assertTrue(NetException.isNetError(error));
        assertTrue(error.getMessage().startsWith(NetException.NET_ERR_MARK));
        assertEquals(CallerConfig.DEFAULT_MAX_CONNECTIONS, caller.availableConnections());
    }

    @Test
    void refusedConnectionIsNetError() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        HttpCaller caller = caller("127.0.0.1:" + port, MetricsCollector.disabled());

        NetException error = assertThrows(NetException.class,
                () -> caller.callRaw("/echo", new byte[0], null, CallOptions.create()));

        assertTrue(NetException.isNetError(error));
    }

    @Test
    void unsupportedResponseEncodingIsRejected() {
        HttpCaller caller = caller(host(), MetricsCollector.disabled());

        EncodingException error = assertThrows(EncodingException.class,
                () -> caller.callRaw("/brotli", new byte[0], null, CallOptions.create()));

        assertTrue(error.getMessage().contains("br"));
    }

    @Test
    void undecodableJsonResponseIsEncodingError() {
        HttpCaller caller = caller(host(), MetricsCollector.disabled());

        assertThrows(EncodingException.class,
                () -> caller.call("/garbage", Map.of(), Map.class, CallOptions.create()));
    }

    @Test
    void everyCallIsMeteredAndErrorsAreTyped() {
        RecordingSender sender = new RecordingSender();
        MetricsCollector metrics = new MetricsCollector(MetricsSettings.defaults().withEnabled(true), sender, null);
        HttpCaller caller = caller(host(), metrics);

        assertThrows(StatusException.class,
                () -> caller.callRaw("/fail", new byte[0], null, CallOptions.create()));
        metrics.flush();

        List<String> counters = new ArrayList<>();
        for (MetricEvent event : sender.counters) {
            counters.add(event.name());
        }
        assertTrue(counters.contains("hostpilot.sdk.request.count"));
        assertTrue(counters.contains("hostpilot.sdk.common.err"));
        MetricEvent error = sender.counters.stream()
                .filter(event -> event.name().equals("hostpilot.sdk.common.err"))
                .findFirst()
                .orElseThrow();
        assertEquals("rsp_status_not_ok", error.tags().get("type"));
        assertEquals("500", error.tags().get("status"));
        assertTrue(sender.puts.stream().anyMatch(event -> event.name().equals("hostpilot.sdk.request.total.cost.max")));
    }

    @Test
    void optionHeadersOverrideDefaults() {
        HttpCaller caller = caller(host(), MetricsCollector.disabled());

        Map<String, String> headers = caller.buildHeaders("application/json",
                CallOptions.create().header("Accept", "text/plain"), "id");

        assertEquals("text/plain", headers.get("Accept"));
        assertEquals("id", headers.get("Request-Id"));
        assertFalse(headers.containsKey("Timeout-Millis"));
    }

    @Test
    void waitingForAConnectionCountsAgainstTheCallTimeout() throws Exception {
        HttpCaller caller = caller(host(), MetricsCollector.disabled(), CallerConfig.defaults().withMaxConnections(1));
        ExecutorService clients = Executors.newSingleThreadExecutor();
        try {
            Future<?> first = clients.submit(() -> assertThrows(CallTimeoutException.class,
                    () -> caller.callRaw("/slow", new byte[0], null,
                            CallOptions.create().timeout(Duration.ofMillis(400)))));
            Thread.sleep(100L);

            long start = System.nanoTime();
            assertThrows(CallTimeoutException.class,
                    () -> caller.callRaw("/slow", new byte[0], null,
                            CallOptions.create().timeout(Duration.ofMillis(500))));
            long elapsedMs = (System.nanoTime() - start) / 1_000_000L;

            assertTrue(elapsedMs < 700L, "second call took " + elapsedMs + "ms");
            first.get(5, TimeUnit.SECONDS);
            assertEquals(1, caller.availableConnections());
        } finally {
            clients.shutdownNow();
        }
    }

    @Test
    void hostIsResolvedOncePerCall() throws CallException {
        AtomicInteger resolutions = new AtomicInteger();
        String host = host();
        HttpCaller caller = new HttpCaller(HttpClient.newHttpClient(), path -> {
            resolutions.incrementAndGet();
            return host;
        }, request -> { }, MetricsCollector.disabled(), CallerConfig.defaults(), "http", null, null, null);

        caller.call("/plain", Map.of("a", 1), Map.class, CallOptions.create());

        assertEquals(1, resolutions.get());
    }

    @Test
    void nullHeaderValueIsRejectedUpFront() {
        CallOptions options = CallOptions.create();

        assertThrows(NullPointerException.class, () -> options.header("X-Trace", null));
        Map<String, String> headers = new HashMap<>();
        headers.put("X-Trace", null);
        assertThrows(NullPointerException.class, () -> options.headers(headers));
        assertTrue(options.headers().isEmpty());
    }

    @Test
    void timeoutClassification() {
        assertTrue(HttpCaller.isTimeout(new HttpTimeoutException("request timed out")));
        assertTrue(HttpCaller.isTimeout(new IOException("Read Timeout")));
        assertFalse(HttpCaller.isTimeout(new IOException("connection reset")));
    }

    private HttpCaller caller(String host, MetricsCollector metrics) {
        return caller(host, metrics, CallerConfig.defaults());
    }

    private HttpCaller caller(String host, MetricsCollector metrics, CallerConfig config) {
        return new HttpCaller(
                HttpClient.newHttpClient(),
                path -> host,
                request -> request.setHeader("X-Signed", "1"),
                metrics,
                config,
                "http",
                "tenant-1",
                "project-1",
                new ObjectMapper()
        );
    }

    private String host() {
        return "127.0.0.1:" + server.getAddress().getPort();
    }

    private void record(HttpExchange exchange, byte[] body) {
        seenHeaders.set(exchange.getRequestHeaders());
        seenBody.set(body);
        seenQuery.set(exchange.getRequestURI().getRawQuery());
    }

    private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.sendResponseHeaders(status, body.length == 0 ? -1 : body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }

    static final class RecordingSender implements MetricsSender {
        final List<MetricEvent> counters = new ArrayList<>();
        final List<MetricEvent> puts = new ArrayList<>();
        final List<LogEvent> logs = new ArrayList<>();

        @Override
        public void sendMetrics(String path, List<MetricEvent> batch) {
            if (COUNTER_PATH.equals(path)) {
                counters.addAll(batch);
            } else {
                puts.addAll(batch);
            }
        }

        @Override
        public void sendLogs(List<LogEvent> batch) {
            logs.addAll(batch);
        }
    }
}

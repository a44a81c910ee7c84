package net.spookly.hostpilot.availability;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpHostConfigFetcherTest {
    private HttpServer server;
    private final AtomicInteger hits = new AtomicInteger();
    private final AtomicInteger status = new AtomicInteger(200);
    private final AtomicReference<String> body = new AtomicReference<>("");
    private final AtomicReference<String> query = new AtomicReference<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/data/api/sdk/host", exchange -> {
            hits.incrementAndGet();
            query.set(exchange.getRequestURI().getRawQuery());
            byte[] payload = body.get().getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status.get(), payload.length == 0 ? -1 : payload.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(payload);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void decodesPathToHostsMapping() {
        body.set("{\"*\": [\"a\", \"b\"], \"Predict\": [\"c\"]}");

        FetchResult result = fetcher().fetch(host(), "project 1");

        assertEquals(FetchResult.Status.OK, result.status());
        assertEquals(Map.of("*", List.of("a", "b"), "Predict", List.of("c")), result.hosts());
        assertEquals("project_id=project+1", query.get());
        assertEquals(1, hits.get());
    }

    @Test
    void notFoundIsFinal() {
        status.set(404);

        FetchResult result = fetcher().fetch(host(), "p");

        assertEquals(FetchResult.Status.NOT_FOUND, result.status());
        assertEquals(1, hits.get());
    }

    @Test
    void serverErrorsAreRetriedThenReported() {
        status.set(500);
        body.set("oops");

        FetchResult result = fetcher().fetch(host(), "p");

        assertEquals(FetchResult.Status.FAILED, result.status());
        assertEquals(3, hits.get());
    }

    @Test
    void undecodableBodyIsRejectedWithoutRetry() {
        body.set("not json");

        FetchResult result = fetcher().fetch(host(), "p");

        assertEquals(FetchResult.Status.INVALID, result.status());
        assertEquals(1, hits.get());
    }

    @Test
    void buildsFetchUrl() {
        assertEquals("http://mgmt.example.com/data/api/sdk/host?project_id=abc",
                HttpHostConfigFetcher.fetchUrl("mgmt.example.com", "abc"));
    }

    private HttpHostConfigFetcher fetcher() {
        return new HttpHostConfigFetcher(HttpClient.newHttpClient(), 2_000, 3);
    }

    private String host() {
        return "127.0.0.1:" + server.getAddress().getPort();
    }
}

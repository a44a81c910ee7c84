package net.spookly.hostpilot.caller;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds the single JDK {@link HttpClient} a client shares across calls, probes, fetches and
 * metrics.
 */
public final class TransportFactory {
    /** Read by the JDK connection pool when the first client of the process is created. */
    static final String KEEP_ALIVE_PROPERTY = "jdk.httpclient.keepalive.timeout";

    private TransportFactory() {
    }

    /**
     * Daemon executor for the client's async work, owned and shut down by the caller.
     */
    public static ExecutorService newExecutor(String namePrefix) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, namePrefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(factory);
    }

    public static HttpClient newHttpClient(CallerConfig config, ExecutorService executor) {
        CallerConfig effective = config == null ? CallerConfig.defaults() : config.withDefaults();
        if (System.getProperty(KEEP_ALIVE_PROPERTY) == null) {
            System.setProperty(KEEP_ALIVE_PROPERTY,
                    Long.toString(Math.max(1L, effective.keepAliveDurationMs() / 1000L)));
        }
        HttpClient.Builder builder = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(Duration.ofMillis(effective.connectTimeoutMs()));
        if (executor != null) {
            builder.executor(executor);
        }
        return builder.build();
    }
}

package net.spookly.hostpilot.caller;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import net.spookly.hostpilot.availability.HealthProbe;
import net.spookly.hostpilot.metrics.MetricsCollector;
import net.spookly.hostpilot.metrics.MetricsKeys;
import net.spookly.hostpilot.util.CancellationToken;
import net.spookly.hostpilot.util.Schedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps pooled connections warm by pinging every known host at a fixed interval.
 */
public final class HeartbeatService implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(HeartbeatService.class);

    private final HealthProbe probe;
    private final Supplier<List<String>> hosts;
    private final MetricsCollector metrics;
    private final String projectId;
    private final CallerConfig config;
    private final CancellationToken token;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private ScheduledExecutorService scheduler;

    public HeartbeatService(HealthProbe probe,
                            Supplier<List<String>> hosts,
                            MetricsCollector metrics,
                            String projectId,
                            CallerConfig config,
                            CancellationToken token) {
        this.probe = Objects.requireNonNull(probe, "probe");
        this.hosts = Objects.requireNonNull(hosts, "hosts");
        this.metrics = metrics == null ? MetricsCollector.disabled() : metrics;
        this.projectId = projectId == null ? "" : projectId;
        this.config = config == null ? CallerConfig.defaults() : config.withDefaults();
        this.token = token == null ? new CancellationToken() : token;
        this.token.onCancel(this::stop);
    }

    public void start() {
        if (stopped.get() || !started.compareAndSet(false, true)) {
            return;
        }
        scheduler = Schedulers.newLoopScheduler("hostpilot-heartbeat", token);
        long interval = config.pingIntervalMs();
        Schedulers.scheduleLoop(scheduler, token, "heartbeat", this::beat, interval, interval);
        LOGGER.debug("Heartbeat started, interval={}ms", interval);
    }

    /**
     * Ping every host once. Probes run asynchronously and are bounded by the ping timeout.
     */
    void beat() {
        for (String host : hosts.get()) {
            Map<String, String> tags = new LinkedHashMap<>();
            tags.put(MetricsKeys.TAG_FROM, "http_caller");
            tags.put(MetricsKeys.TAG_PROJECT_ID, projectId);
            tags.put(MetricsKeys.TAG_HOST, host);
            metrics.counter(MetricsKeys.HEARTBEAT_COUNT, 1, tags);
            probe.probe(host, config.pingTimeoutMs()).exceptionally(error -> {
                LOGGER.debug("Heartbeat to {} failed: {}", host, error.toString());
                return false;
            });
        }
    }

    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        if (scheduler != null) {
            scheduler.shutdown();
        }
    }

    @Override
    public void close() {
        stop();
    }
}

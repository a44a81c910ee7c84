package net.spookly.hostpilot.metrics;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import net.spookly.hostpilot.util.CancellationToken;
import net.spookly.hostpilot.util.Schedulers;
import net.spookly.hostpilot.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-blocking metrics and log pipeline.
 *
 * <p>Emit calls only ever offer to a bounded queue; when a queue is full the event is dropped
 * and counted. A flush loop drains both queues, aggregates metrics per name and tag set, and
 * ships the batches through a {@link MetricsSender}. Send failures are logged and dropped.
 */
public final class MetricsCollector implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(MetricsCollector.class);
    private static final MetricsCollector DISABLED = new MetricsCollector(MetricsSettings.defaults(), null, null);

    private final MetricsSettings settings;
    private final MetricsSender sender;
    private final CancellationToken token;
    private final BlockingQueue<MetricEvent> metricQueue;
    private final BlockingQueue<LogEvent> logQueue;
    private final AtomicLong droppedMetrics = new AtomicLong();
    private final AtomicLong droppedLogs = new AtomicLong();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final Object flushLock = new Object();
    private ScheduledExecutorService scheduler;

    public MetricsCollector(MetricsSettings settings, MetricsSender sender, CancellationToken token) {
        this.settings = settings == null ? MetricsSettings.defaults() : settings;
        if (this.settings.enabled() && sender == null) {
            throw new IllegalArgumentException("metrics are enabled but no sender is configured");
        }
        if (this.settings.queueCapacity() < 1) {
            throw new IllegalArgumentException("metrics queue capacity must be >= 1");
        }
        this.sender = sender;
        this.token = token == null ? new CancellationToken() : token;
        int capacity = this.settings.enabled() ? this.settings.queueCapacity() : 1;
        this.metricQueue = new ArrayBlockingQueue<>(capacity);
        this.logQueue = new ArrayBlockingQueue<>(capacity);
        this.token.onCancel(this::shutdown);
    }

    /**
     * Collector that accepts and discards everything.
     */
    public static MetricsCollector disabled() {
        return DISABLED;
    }

    public boolean isEnabled() {
        return settings.enabled();
    }

    /**
     * Start the periodic flush loop. No-op when disabled or already started.
     */
    public void start() {
        if (!settings.enabled() || stopped.get() || !started.compareAndSet(false, true)) {
            return;
        }
        long interval = settings.effectiveFlushIntervalMs();
        scheduler = Schedulers.newLoopScheduler("hostpilot-metrics-flush", token);
        Schedulers.scheduleLoop(scheduler, token, "metrics-flush", this::flush, interval, interval);
    }

    public void counter(String name, double value, Map<String, String> tags) {
        emit(name, value, MetricType.COUNTER, tags);
    }

    public void timer(String name, double value, Map<String, String> tags) {
        emit(name, value, MetricType.TIMER, tags);
    }

    public void store(String name, double value, Map<String, String> tags) {
        emit(name, value, MetricType.STORE, tags);
    }

    public void info(String id, String message) {
        log(id, message, LogLevel.INFO);
    }

    public void warn(String id, String message) {
        log(id, message, LogLevel.WARN);
    }

    public void error(String id, String message) {
        log(id, message, LogLevel.ERROR);
    }

    public long droppedMetrics() {
        return droppedMetrics.get();
    }

    public long droppedLogs() {
        return droppedLogs.get();
    }

    public int pendingMetrics() {
        return metricQueue.size();
    }

    public int pendingLogs() {
        return logQueue.size();
    }

    /**
     * Drain both queues and ship what was collected. Safe to call from any thread.
     */
    public void flush() {
        if (!settings.enabled()) {
            return;
        }
        synchronized (flushLock) {
            List<MetricEvent> events = new ArrayList<>();
            metricQueue.drainTo(events);
            List<LogEvent> logs = new ArrayList<>();
            logQueue.drainTo(logs);
            if (!events.isEmpty()) {
                long timestamp = nowSeconds();
                List<MetricEvent> counters = new ArrayList<>();
                List<MetricEvent> others = new ArrayList<>();
                aggregate(events, timestamp, counters, others);
                ship(MetricsSender.COUNTER_PATH, counters);
                ship(MetricsSender.PUT_PATH, others);
            }
            if (!logs.isEmpty()) {
                try {
                    sender.sendLogs(logs);
                } catch (IOException | RuntimeException e) {
                    LOGGER.warn("Sending {} log records failed: {}", logs.size(), e.getMessage());
                }
            }
        }
    }

    /**
     * Stop the flush loop and make one last flush. Idempotent.
     */
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        if (scheduler != null) {
            scheduler.shutdown();
        }
        flush();
        if (sender != null) {
            sender.close();
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    private void emit(String name, double value, MetricType type, Map<String, String> tags) {
        if (!settings.enabled() || Strings.isBlank(name)) {
            return;
        }
        MetricEvent event = new MetricEvent(name, value, type, nowSeconds(), escapeTags(tags));
        if (!metricQueue.offer(event)) {
            droppedMetrics.incrementAndGet();
        }
    }

    private void log(String id, String message, LogLevel level) {
        if (!settings.enabled() || !settings.logsEnabled()) {
            return;
        }
        if (!logQueue.offer(new LogEvent(id, message, level, nowSeconds()))) {
            droppedLogs.incrementAndGet();
        }
    }

    private void aggregate(List<MetricEvent> events,
                           long timestamp,
                           List<MetricEvent> counters,
                           List<MetricEvent> others) {
        Map<String, Bucket> buckets = new LinkedHashMap<>();
        for (MetricEvent event : events) {
            String key = event.type() + "|" + event.name() + "|" + new TreeMap<>(event.tags());
            buckets.computeIfAbsent(key, ignored -> new Bucket(event)).add(event.value());
        }
        for (Bucket bucket : buckets.values()) {
            String name = settings.prefix() + "." + bucket.name;
            switch (bucket.type) {
                case COUNTER:
                    counters.add(new MetricEvent(name, bucket.sum, MetricType.COUNTER, timestamp, bucket.tags));
                    break;
                case STORE:
                    others.add(new MetricEvent(name, bucket.last, MetricType.STORE, timestamp, bucket.tags));
                    break;
                case TIMER:
                    TimerStats stats = TimerStats.of(bucket.samples());
                    for (Map.Entry<String, Double> stat : stats.report().entrySet()) {
                        others.add(new MetricEvent(name + "." + stat.getKey(), stat.getValue(),
                                MetricType.TIMER, timestamp, bucket.tags));
                    }
                    break;
                default:
                    break;
            }
        }
    }

    private void ship(String path, List<MetricEvent> batch) {
        if (batch.isEmpty()) {
            return;
        }
        try {
            sender.sendMetrics(path, batch);
            LOGGER.debug("Sent {} metrics to {}", batch.size(), path);
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("Sending {} metrics to {} failed: {}", batch.size(), path, e.getMessage());
        }
    }

    private static Map<String, String> escapeTags(Map<String, String> tags) {
        if (tags == null || tags.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, String> escaped = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : tags.entrySet()) {
            escaped.put(entry.getKey(), Strings.escapeTagValue(entry.getValue()));
        }
        return escaped;
    }

    private static long nowSeconds() {
        return System.currentTimeMillis() / 1000L;
    }

    private static final class Bucket {
        private final String name;
        private final MetricType type;
        private final Map<String, String> tags;
        private final List<Long> values = new ArrayList<>();
        private double sum;
        private double last;

        private Bucket(MetricEvent first) {
            this.name = first.name();
            this.type = first.type();
            this.tags = first.tags();
        }

        private void add(double value) {
            sum += value;
            last = value;
            if (type == MetricType.TIMER) {
                values.add((long) value);
            }
        }

        private long[] samples() {
            long[] result = new long[values.size()];
            for (int i = 0; i < values.size(); i++) {
                result[i] = values.get(i);
            }
            return result;
        }
    }
}

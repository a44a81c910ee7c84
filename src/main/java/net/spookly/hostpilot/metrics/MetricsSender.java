package net.spookly.hostpilot.metrics;

import java.io.IOException;
import java.util.List;

/**
 * Ships aggregated batches to the reporting service.
 */
public interface MetricsSender extends AutoCloseable {
    String COUNTER_PATH = "/api/counter";
    String PUT_PATH = "/api/put";
    String LOG_PATH = "/api/log";

    void sendMetrics(String path, List<MetricEvent> batch) throws IOException;

    void sendLogs(List<LogEvent> batch) throws IOException;

    @Override
    default void close() {
    }
}

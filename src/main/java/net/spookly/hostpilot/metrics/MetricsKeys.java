package net.spookly.hostpilot.metrics;

/**
 * Metric names emitted by the transport core, before the configured prefix is applied.
 */
public final class MetricsKeys {
    public static final String REQUEST_TOTAL_COST = "request.total.cost";
    public static final String REQUEST_COUNT = "request.count";
    public static final String HEARTBEAT_COUNT = "heartbeat.count";
    public static final String COMMON_ERROR = "common.err";

    public static final String TAG_PROJECT_ID = "project_id";
    public static final String TAG_URL = "url";
    public static final String TAG_HOST = "host";
    public static final String TAG_TYPE = "type";
    public static final String TAG_STATUS = "status";
    public static final String TAG_FROM = "from";

    private MetricsKeys() {
    }
}

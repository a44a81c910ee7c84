package net.spookly.hostpilot.availability;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores hosts by actively probing them and keeping a sliding window of outcomes per host.
 */
public final class PingHostScorer implements HostScorer {
    private static final Logger LOGGER = LoggerFactory.getLogger(PingHostScorer.class);
    private static final long PROBE_GRACE_MS = 50L;

    private final HealthProbe probe;
    private final int windowSize;
    private final int timeoutMs;
    private final Map<String, SlidingWindow> windows = new HashMap<>();

    public PingHostScorer(HealthProbe probe, int windowSize, int timeoutMs) {
        this.probe = Objects.requireNonNull(probe, "probe");
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be at least 1");
        }
        this.windowSize = windowSize;
        this.timeoutMs = timeoutMs;
    }

    /**
     * Probe every host once and score it as {@code 1 - failureRate}.
     * A single host is never probed and scores 0.
     */
    @Override
    public synchronized List<HostScore> scoreHosts(List<String> hosts) {
        if (hosts == null || hosts.isEmpty()) {
            return List.of();
        }
        LOGGER.debug("Scoring hosts {}", hosts);
        if (hosts.size() == 1) {
            return List.of(new HostScore(hosts.get(0), 0.0));
        }
        List<CompletableFuture<Boolean>> outcomes = new ArrayList<>(hosts.size());
        for (String host : hosts) {
            outcomes.add(probeQuietly(host));
        }
        windows.keySet().retainAll(new HashSet<>(hosts));
        List<HostScore> scores = new ArrayList<>(hosts.size());
        for (int i = 0; i < hosts.size(); i++) {
            String host = hosts.get(i);
            SlidingWindow window = windows.computeIfAbsent(host, ignored -> new SlidingWindow(windowSize));
            window.put(outcomes.get(i).join());
            scores.add(new HostScore(host, 1.0 - window.failureRate()));
        }
        return scores;
    }

    /**
     * Current failure rate for a host, or 0 when it has never been observed.
     */
    public synchronized double failureRate(String host) {
        SlidingWindow window = windows.get(host);
        return window == null ? 0.0 : window.failureRate();
    }

    private CompletableFuture<Boolean> probeQuietly(String host) {
        try {
            CompletableFuture<Boolean> result = probe.probe(host, timeoutMs)
                    .exceptionally(error -> false)
                    .thenApply(Boolean.TRUE::equals);
            if (timeoutMs > 0) {
                result = result.completeOnTimeout(false, timeoutMs + PROBE_GRACE_MS, TimeUnit.MILLISECONDS);
            }
            return result;
        } catch (RuntimeException e) {
            LOGGER.warn("Probe for host {} failed to start: {}", host, e.getMessage());
            return CompletableFuture.completedFuture(false);
        }
    }

    @Override
    public void close() {
        try {
            probe.close();
        } catch (Exception e) {
            LOGGER.warn("Failed to stop health probe: {}", e.getMessage());
        }
    }
}

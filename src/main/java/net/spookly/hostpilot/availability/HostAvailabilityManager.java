package net.spookly.hostpilot.availability;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicReference;

import net.spookly.hostpilot.config.ConfigException;
import net.spookly.hostpilot.util.CancellationToken;
import net.spookly.hostpilot.util.Schedulers;
import net.spookly.hostpilot.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps a live, best-first host list per path and serves it without blocking.
 *
 * <p>Two independent loops run once started: a re-scoring loop that reorders the current
 * config by probe scores, and, when a project id is set, a refresh loop that pulls the
 * config from the management endpoint. The config is swapped as a whole; readers see either
 * the old or the new snapshot. Probe and fetch failures only ever keep the last known config.
 */
public final class HostAvailabilityManager implements HostResolver, AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(HostAvailabilityManager.class);

    public enum State {
        UNINITIALIZED,
        RUNNING,
        SHUTDOWN
    }

    private final HostScorer scorer;
    private final HostConfigFetcher fetcher;
    private final String projectId;
    private final AvailabilitySettings settings;
    private final CancellationToken token;
    private final AtomicReference<HostConfig> hostConfig;
    private final AtomicReference<State> state = new AtomicReference<>(State.UNINITIALIZED);
    private final Object passLock = new Object();
    private final Object lifecycleLock = new Object();
    private ScheduledExecutorService scoringScheduler;
    private ScheduledExecutorService refreshScheduler;

    /**
     * @param fetcher   remote config source, or null to serve only the default hosts.
     * @param projectId enables the refresh loop when non-blank and a fetcher is present.
     */
    public HostAvailabilityManager(List<String> defaultHosts,
                                   String projectId,
                                   HostScorer scorer,
                                   HostConfigFetcher fetcher,
                                   AvailabilitySettings settings,
                                   CancellationToken token) {
        if (defaultHosts == null || defaultHosts.isEmpty()) {
            throw new ConfigException("default hosts are empty");
        }
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.fetcher = fetcher;
        this.projectId = projectId;
        this.settings = settings == null ? AvailabilitySettings.defaults() : settings;
        this.token = token == null ? new CancellationToken() : token;
        try {
            this.hostConfig = new AtomicReference<>(HostConfig.ofDefaults(defaultHosts));
        } catch (IllegalArgumentException e) {
            throw new ConfigException("default hosts are empty", e);
        }
        this.token.onCancel(this::shutdown);
    }

    /**
     * Start the background loops. Calling it again, or after shutdown, does nothing.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (!state.compareAndSet(State.UNINITIALIZED, State.RUNNING)) {
                return;
            }
            try {
                scoringScheduler = Schedulers.newLoopScheduler("hostpilot-host-scoring", token);
                Schedulers.scheduleLoop(scoringScheduler, token, "host-scoring", this::rescore,
                        0L, settings.scoreIntervalMs());
                if (isRefreshEnabled()) {
                    refreshScheduler = Schedulers.newLoopScheduler("hostpilot-host-refresh", token);
                    Schedulers.scheduleLoop(refreshScheduler, token, "host-refresh", this::refreshFromServer,
                            0L, settings.refreshIntervalMs());
                }
            } catch (RejectedExecutionException e) {
                // the token was cancelled while the loops were being scheduled
                LOGGER.debug("Host availability loops not started: {}", e.getMessage());
            }
        }
    }

    /**
     * Best host for the exact path, falling back to the best default host.
     */
    @Override
    public String getHost(String path) {
        return hostConfig.get().firstHost(path);
    }

    /**
     * Every configured host once, across all paths.
     */
    public List<String> getHosts() {
        return hostConfig.get().distinctHosts();
    }

    public HostConfig currentConfig() {
        return hostConfig.get();
    }

    public State state() {
        return state.get();
    }

    /**
     * Stop both loops. Idempotent; hosts keep being served from the last config.
     */
    public void shutdown() {
        State previous = state.getAndSet(State.SHUTDOWN);
        if (previous == State.SHUTDOWN) {
            return;
        }
        synchronized (lifecycleLock) {
            if (scoringScheduler != null) {
                scoringScheduler.shutdown();
            }
            if (refreshScheduler != null) {
                refreshScheduler.shutdown();
            }
        }
        scorer.close();
        if (fetcher != null) {
            fetcher.close();
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * One re-scoring pass over the current config.
     */
    void rescore() {
        synchronized (passLock) {
            scoreAndApply(hostConfig.get());
        }
    }

    /**
     * One refresh attempt against the management endpoint, retries included.
     */
    void refreshFromServer() {
        if (!isRefreshEnabled()) {
            return;
        }
        String host = getHost(HostConfig.DEFAULT_PATH);
        FetchResult result = fetcher.fetch(host, projectId);
        if (result.status() == FetchResult.Status.NOT_FOUND) {
            LOGGER.debug("No remote host config for project {}, keeping current hosts", projectId);
            return;
        }
        if (!result.isOk()) {
            LOGGER.warn("Remote host refresh {} for project {}, keeping current hosts", result.status(), projectId);
            return;
        }
        Map<String, List<String>> fetched = result.hosts();
        if (!HostConfig.hasDefaultHosts(fetched)) {
            LOGGER.warn("No default hosts in config from server, host={} config={}", host, fetched);
            return;
        }
        synchronized (passLock) {
            if (hostConfig.get().sameHostSets(fetched)) {
                LOGGER.debug("Hosts from server are not changed, config={}", fetched);
                return;
            }
            scoreAndApply(HostConfig.of(fetched));
        }
    }

    private void scoreAndApply(HostConfig input) {
        List<HostScore> scores;
        try {
            scores = scorer.scoreHosts(input.distinctHosts());
        } catch (RuntimeException e) {
            LOGGER.error("Scoring hosts failed: {}", e.getMessage(), e);
            return;
        }
        LOGGER.debug("Score hosts result: {}", scores);
        if (scores == null || scores.isEmpty()) {
            LOGGER.error("Scoring hosts returned an empty list");
            return;
        }
        HostConfig next = allAtOrAboveFailureThreshold(scores) ? input : sortByScore(input, scores);
        HostConfig current = hostConfig.get();
        if (next.sameOrder(current)) {
            LOGGER.debug("Host order is not changed, config={}", next);
            return;
        }
        LOGGER.debug("Set new host config {}, old config {}", next, current);
        hostConfig.set(next);
    }

    private boolean allAtOrAboveFailureThreshold(List<HostScore> scores) {
        for (HostScore score : scores) {
            if (1.0 - score.score() < settings.failureRateThreshold()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Reorder every path descending by score. {@link List#sort} is stable, so equal scores keep
     * their relative order.
     */
    static HostConfig sortByScore(HostConfig input, List<HostScore> scores) {
        Map<String, Double> scoreIndex = new HashMap<>();
        for (HostScore score : scores) {
            scoreIndex.put(score.host(), score.score());
        }
        Comparator<String> byScoreDescending = Comparator.comparingDouble(
                (String host) -> scoreIndex.getOrDefault(host, 0.0)).reversed();
        Map<String, List<String>> sorted = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : input.asMap().entrySet()) {
            List<String> hosts = new ArrayList<>(entry.getValue());
            hosts.sort(byScoreDescending);
            sorted.put(entry.getKey(), hosts);
        }
        return HostConfig.of(sorted);
    }

    private boolean isRefreshEnabled() {
        return fetcher != null && !Strings.isBlank(projectId);
    }
}

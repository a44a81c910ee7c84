package net.spookly.hostpilot.availability;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable path to best-first host list mapping.
 *
 * <p>The {@code "*"} entry is mandatory and non-empty; it serves every path without its own entry.
 */
public final class HostConfig {
    public static final String DEFAULT_PATH = "*";

    private final Map<String, List<String>> hostsByPath;

    private HostConfig(Map<String, List<String>> hostsByPath) {
        this.hostsByPath = hostsByPath;
    }

    /**
     * Copy and validate a mapping. Blank hosts are dropped; paths left empty are ignored.
     */
    public static HostConfig of(Map<String, List<String>> hostsByPath) {
        if (!hasDefaultHosts(hostsByPath)) {
            throw new IllegalArgumentException("host config requires a non-empty '" + DEFAULT_PATH + "' entry");
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : hostsByPath.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            List<String> hosts = new ArrayList<>(entry.getValue().size());
            for (String host : entry.getValue()) {
                if (host != null && !host.trim().isEmpty()) {
                    hosts.add(host.trim());
                }
            }
            if (!hosts.isEmpty()) {
                copy.put(entry.getKey(), Collections.unmodifiableList(hosts));
            }
        }
        if (!copy.containsKey(DEFAULT_PATH)) {
            throw new IllegalArgumentException("host config requires a non-empty '" + DEFAULT_PATH + "' entry");
        }
        return new HostConfig(Collections.unmodifiableMap(copy));
    }

    /**
     * Config with only the default entry.
     */
    public static HostConfig ofDefaults(List<String> hosts) {
        Map<String, List<String>> map = new LinkedHashMap<>();
        map.put(DEFAULT_PATH, hosts);
        return of(map);
    }

    /**
     * True when the mapping carries a {@code "*"} entry with at least one non-blank host.
     */
    public static boolean hasDefaultHosts(Map<String, List<String>> hostsByPath) {
        if (hostsByPath == null) {
            return false;
        }
        List<String> defaults = hostsByPath.get(DEFAULT_PATH);
        if (defaults == null) {
            return false;
        }
        for (String host : defaults) {
            if (host != null && !host.trim().isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Best host for an exact path match, otherwise the best default host.
     */
    public String firstHost(String path) {
        List<String> hosts = path == null ? null : hostsByPath.get(path);
        if (hosts != null && !hosts.isEmpty()) {
            return hosts.get(0);
        }
        return hostsByPath.get(DEFAULT_PATH).get(0);
    }

    public List<String> hosts(String path) {
        List<String> hosts = hostsByPath.get(path);
        return hosts == null ? List.of() : hosts;
    }

    /**
     * De-duplicated union of all hosts, in first-seen order.
     */
    public List<String> distinctHosts() {
        Set<String> hosts = new LinkedHashSet<>();
        for (List<String> pathHosts : hostsByPath.values()) {
            hosts.addAll(pathHosts);
        }
        return List.copyOf(hosts);
    }

    public Set<String> paths() {
        return hostsByPath.keySet();
    }

    public Map<String, List<String>> asMap() {
        return hostsByPath;
    }

    /**
     * Same paths with identical host order on each.
     */
    public boolean sameOrder(HostConfig other) {
        return other != null && hostsByPath.equals(other.hostsByPath);
    }

    /**
     * Same paths with the same host set on each, ignoring order.
     */
    public boolean sameHostSets(Map<String, List<String>> other) {
        if (other == null || other.size() != hostsByPath.size()) {
            return false;
        }
        for (Map.Entry<String, List<String>> entry : other.entrySet()) {
            List<String> current = hostsByPath.get(entry.getKey());
            if (current == null || entry.getValue() == null || current.size() != entry.getValue().size()) {
                return false;
            }
            if (!new HashSet<>(current).equals(new HashSet<>(entry.getValue()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HostConfig)) {
            return false;
        }
        return hostsByPath.equals(((HostConfig) o).hostsByPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hostsByPath);
    }

    @Override
    public String toString() {
        return hostsByPath.toString();
    }
}

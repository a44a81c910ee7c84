package net.spookly.hostpilot.caller;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memoizes {@code schema://host/path} strings for one client.
 */
final class UrlBuilder {
    private final String schema;
    private final Map<String, String> urls = new ConcurrentHashMap<>();

    UrlBuilder(String schema) {
        this.schema = schema;
    }

    String url(String host, String path) {
        return urls.computeIfAbsent(host + "\n" + path, ignored -> schema + "://" + host + normalizePath(path));
    }

    int size() {
        return urls.size();
    }

    static String normalizePath(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        return path.startsWith("/") ? path : "/" + path;
    }
}

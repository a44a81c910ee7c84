package net.spookly.hostpilot.auth;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Transport-neutral view of an outgoing request that signers can read and add headers to.
 *
 * <p>Header names are case-insensitive; the first spelling used for a name is kept.
 */
@Getter
@Accessors(fluent = true)
public final class SignableRequest {
    private static final char[] UPPER_HEX = "0123456789ABCDEF".toCharArray();

    private final String method;
    private final String scheme;
    /** {@code host} or {@code host:port}. */
    private final String authority;
    private String path;
    private final byte[] body;
    @Getter(AccessLevel.NONE)
    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    @Getter(AccessLevel.NONE)
    private final List<Map.Entry<String, String>> queryParams = new ArrayList<>();

    public SignableRequest(String method, String scheme, String authority, String path, byte[] body) {
        this.method = Objects.requireNonNull(method, "method");
        this.scheme = Objects.requireNonNull(scheme, "scheme");
        this.authority = Objects.requireNonNull(authority, "authority");
        this.path = path == null ? "" : path;
        this.body = body == null ? new byte[0] : body;
    }

    public void path(String path) {
        this.path = path == null ? "" : path;
    }

    public String header(String name) {
        return headers.get(name);
    }

    public boolean hasHeader(String name) {
        String value = headers.get(name);
        return value != null && !value.isEmpty();
    }

    public void setHeader(String name, String value) {
        headers.put(name, value);
    }

    public Map<String, String> headers() {
        return Collections.unmodifiableMap(headers);
    }

    public void addQueryParam(String name, String value) {
        queryParams.add(new AbstractMap.SimpleImmutableEntry<>(name, value == null ? "" : value));
    }

    public List<Map.Entry<String, String>> queryParams() {
        return Collections.unmodifiableList(queryParams);
    }

    /**
     * Query string with every key and value percent-encoded, in insertion order.
     */
    public String rawQuery() {
        StringBuilder query = new StringBuilder();
        for (Map.Entry<String, String> param : queryParams) {
            if (query.length() > 0) {
                query.append('&');
            }
            query.append(percentEncode(param.getKey())).append('=').append(percentEncode(param.getValue()));
        }
        return query.toString();
    }

    public URI toUri() {
        StringBuilder uri = new StringBuilder(scheme).append("://").append(authority);
        uri.append(path.isEmpty() ? "/" : path);
        String query = rawQuery();
        if (!query.isEmpty()) {
            uri.append('?').append(query);
        }
        return URI.create(uri.toString());
    }

    /**
     * UTF-8 percent-encoding that leaves only {@code A-Z a-z 0-9 - _ . ~} as is,
     * with upper-case hex digits.
     */
    public static String percentEncode(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        StringBuilder out = new StringBuilder(bytes.length);
        for (byte b : bytes) {
            int c = b & 0xff;
            if (isUnreserved(c)) {
                out.append((char) c);
            } else {
                out.append('%').append(UPPER_HEX[c >>> 4]).append(UPPER_HEX[c & 0x0f]);
            }
        }
        return out.toString();
    }

    private static boolean isUnreserved(int c) {
        return (c >= 'a' && c <= 'z')
                || (c >= 'A' && c <= 'Z')
                || (c >= '0' && c <= '9')
                || c == '-' || c == '_' || c == '.' || c == '~';
    }
}

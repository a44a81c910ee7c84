package net.spookly.hostpilot.auth;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import net.spookly.hostpilot.util.Strings;

/**
 * SigV4-style HMAC-SHA256 request signing.
 *
 * <p>The canonical request covers the method, the escaped path, the sorted query, the
 * {@code content-type}, {@code content-md5}, {@code host} and {@code x-*} headers and the
 * SHA-256 of the body. The signing key is derived from the secret through date, region,
 * service and the literal {@code request}.
 */
public final class HmacRequestSigner implements RequestSigner {
    public static final String ALGORITHM = "HMAC-SHA256";
    public static final String DEFAULT_CONTENT_TYPE = "application/x-www-form-urlencoded; charset=utf-8";

    static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'", Locale.ROOT).withZone(ZoneOffset.UTC);

    private static final String SCOPE_TERMINATOR = "request";

    private final Credential credential;
    private final Clock clock;

    public HmacRequestSigner(Credential credential) {
        this(credential, Clock.systemUTC());
    }

    public HmacRequestSigner(Credential credential, Clock clock) {
        this.credential = Objects.requireNonNull(credential, "credential");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void sign(SignableRequest request) {
        if (!request.hasHeader("Content-Type")) {
            request.setHeader("Content-Type", DEFAULT_CONTENT_TYPE);
        }
        if (!request.hasHeader("X-Date")) {
            request.setHeader("X-Date", TIMESTAMP_FORMAT.format(clock.instant()));
        }
        if (request.path().isEmpty()) {
            request.path("/");
        }
        String payloadHash = Hashing.sha256Hex(request.body());
        request.setHeader("X-Content-Sha256", payloadHash);

        List<String> signedNames = signedHeaderNames(request);
        String signedHeaders = String.join(";", signedNames);
        String canonicalRequest = String.join("\n",
                request.method().toUpperCase(Locale.ROOT),
                canonicalUri(request.path()),
                canonicalQuery(request.queryParams()),
                canonicalHeaders(request, signedNames),
                signedHeaders,
                payloadHash);

        String timestamp = request.header("X-Date");
        String date = timestamp.length() >= 8 ? timestamp.substring(0, 8) : timestamp;
        String scope = String.join("/", date, credential.region(), credential.service(), SCOPE_TERMINATOR);
        String stringToSign = String.join("\n", ALGORITHM, timestamp, scope, Hashing.sha256Hex(canonicalRequest));

        byte[] key = signingKey(credential.secretKey(), date, credential.region(), credential.service());
        String signature = Hashing.hex(Hashing.hmacSha256(key, stringToSign));

        request.setHeader("Authorization", ALGORITHM
                + " Credential=" + credential.accessKeyId() + "/" + scope
                + ", SignedHeaders=" + signedHeaders
                + ", Signature=" + signature);
        if (!Strings.isBlank(credential.sessionToken())) {
            request.setHeader("X-Security-Token", credential.sessionToken());
        }
    }

    static byte[] signingKey(String secretKey, String date, String region, String service) {
        byte[] kDate = Hashing.hmacSha256(secretKey.getBytes(StandardCharsets.UTF_8), date);
        byte[] kRegion = Hashing.hmacSha256(kDate, region);
        byte[] kService = Hashing.hmacSha256(kRegion, service);
        return Hashing.hmacSha256(kService, SCOPE_TERMINATOR);
    }

    /**
     * Lower-cased, sorted names of the headers covered by the signature. {@code host} is always
     * included and taken from the request authority.
     */
    static List<String> signedHeaderNames(SignableRequest request) {
        List<String> names = new ArrayList<>();
        names.add("host");
        for (String name : request.headers().keySet()) {
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.equals("host")) {
                continue;
            }
            if (lower.equals("content-type") || lower.equals("content-md5") || lower.startsWith("x-")) {
                names.add(lower);
            }
        }
        names.sort(Comparator.naturalOrder());
        return names;
    }

    static String canonicalHeaders(SignableRequest request, List<String> signedNames) {
        StringBuilder out = new StringBuilder();
        for (String name : signedNames) {
            String value = name.equals("host") ? canonicalHost(request.authority()) : request.header(name);
            out.append(name).append(':').append(value == null ? "" : value.trim()).append('\n');
        }
        return out.toString();
    }

    static String canonicalHost(String authority) {
        int colon = authority.lastIndexOf(':');
        if (colon > 0 && authority.indexOf(']') < colon) {
            String port = authority.substring(colon + 1);
            if (port.equals("80") || port.equals("443")) {
                return authority.substring(0, colon);
            }
        }
        return authority;
    }

    /**
     * Each path segment escaped on its own; slashes are kept.
     */
    static String canonicalUri(String path) {
        String[] segments = path.split("/", -1);
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                out.append('/');
            }
            out.append(SignableRequest.percentEncode(segments[i]));
        }
        return out.toString();
    }

    /**
     * Sorted by key; values of a repeated key keep their order.
     */
    static String canonicalQuery(List<Map.Entry<String, String>> params) {
        List<Map.Entry<String, String>> sorted = new ArrayList<>(params);
        sorted.sort(Map.Entry.comparingByKey());
        StringBuilder out = new StringBuilder();
        for (Map.Entry<String, String> param : sorted) {
            if (out.length() > 0) {
                out.append('&');
            }
            out.append(SignableRequest.percentEncode(param.getKey()))
                    .append('=')
                    .append(SignableRequest.percentEncode(param.getValue()));
        }
        return out.toString();
    }
}

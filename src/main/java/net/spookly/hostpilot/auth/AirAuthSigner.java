package net.spookly.hostpilot.auth;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Token-based signing: {@code sha256Hex(token + body + tenantId + ts + nonce)}.
 *
 * <p>{@code ts} is the current epoch second. The server rejects stale timestamps, so requests
 * must be sent right after signing.
 */
public final class AirAuthSigner implements RequestSigner {
    public static final String HEADER_TS = "Tenant-Ts";
    public static final String HEADER_NONCE = "Tenant-Nonce";
    public static final String HEADER_SIGNATURE = "Tenant-Signature";

    private final String token;
    private final String tenantId;
    private final Clock clock;
    private final Supplier<String> nonceSupplier;

    public AirAuthSigner(String token, String tenantId) {
        this(token, tenantId, Clock.systemUTC(), AirAuthSigner::randomNonce);
    }

    public AirAuthSigner(String token, String tenantId, Clock clock, Supplier<String> nonceSupplier) {
        this.token = Objects.requireNonNull(token, "token");
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.nonceSupplier = Objects.requireNonNull(nonceSupplier, "nonceSupplier");
    }

    @Override
    public void sign(SignableRequest request) {
        String ts = Long.toString(clock.instant().getEpochSecond());
        String nonce = nonceSupplier.get();
        request.setHeader(HEADER_TS, ts);
        request.setHeader(HEADER_NONCE, nonce);
        request.setHeader(HEADER_SIGNATURE, signature(request.body(), ts, nonce));
    }

    String signature(byte[] body, String ts, String nonce) {
        return Hashing.sha256Hex(
                token.getBytes(StandardCharsets.UTF_8),
                body,
                tenantId.getBytes(StandardCharsets.UTF_8),
                ts.getBytes(StandardCharsets.UTF_8),
                nonce.getBytes(StandardCharsets.UTF_8));
    }

    static String randomNonce() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}

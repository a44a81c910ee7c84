package net.spookly.hostpilot.auth;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Access key pair plus the scope it signs for.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class Credential {
    private final String accessKeyId;
    private final String secretKey;
    private final String region;
    private final String service;
    /** Optional; sent as {@code X-Security-Token} when present. */
    private final String sessionToken;

    public Credential(String accessKeyId, String secretKey, String region, String service) {
        this(accessKeyId, secretKey, region, service, null);
    }

    @Override
    public String toString() {
        return "Credential{accessKeyId=" + accessKeyId
                + ", secretKey=" + SecretRedactor.redact(secretKey)
                + ", region=" + region
                + ", service=" + service
                + ", sessionToken=" + SecretRedactor.redact(sessionToken)
                + "}";
    }
}

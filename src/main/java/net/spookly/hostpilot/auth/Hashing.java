package net.spookly.hostpilot.auth;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

public final class Hashing {
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private Hashing() {
    }

    public static String sha256Hex(byte[] content) {
        return hex(newSha256().digest(content == null ? new byte[0] : content));
    }

    public static String sha256Hex(String content) {
        return sha256Hex(content == null ? null : content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * SHA-256 over the concatenation of all parts, in order.
     */
    public static String sha256Hex(byte[]... parts) {
        MessageDigest digest = newSha256();
        for (byte[] part : parts) {
            if (part != null) {
                digest.update(part);
            }
        }
        return hex(digest.digest());
    }

    public static byte[] hmacSha256(byte[] key, String content) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
            return mac.doFinal(content.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to compute HMAC", e);
        }
    }

    public static String hex(byte[] bytes) {
        return HexFormat.of().formatHex(bytes);
    }

    private static MessageDigest newSha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}

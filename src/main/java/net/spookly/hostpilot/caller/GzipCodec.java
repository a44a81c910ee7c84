package net.spookly.hostpilot.caller;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

final class GzipCodec {
    static final String GZIP = "gzip";

    private GzipCodec() {
    }

    static byte[] compress(byte[] data) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(32, data.length / 2));
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(data);
        }
        return out.toByteArray();
    }

    static byte[] decompress(byte[] data) throws IOException {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(data))) {
            return in.readAllBytes();
        }
    }

    /**
     * Decode a response body according to its {@code Content-Encoding}; only gzip and no
     * encoding are accepted.
     */
    static byte[] decode(String contentEncoding, byte[] body, String requestId) throws EncodingException {
        String encoding = contentEncoding == null ? "" : contentEncoding.trim().toLowerCase(Locale.ROOT);
        if (encoding.isEmpty()) {
            return body;
        }
        if (!encoding.equals(GZIP)) {
            throw new EncodingException("unsupported response content encoding: " + encoding, requestId);
        }
        if (body == null || body.length == 0) {
            return new byte[0];
        }
        try {
            return decompress(body);
        } catch (IOException e) {
            throw new EncodingException("decompress gzip response failed: " + e.getMessage(), requestId, e);
        }
    }
}

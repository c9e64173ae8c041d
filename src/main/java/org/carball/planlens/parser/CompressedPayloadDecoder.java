package org.carball.planlens.parser;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.zip.GZIPInputStream;
import java.util.zip.InflaterInputStream;

/**
 * Decodes {@code COMPRESSED_XML:<base64>} payloads. Both gzip and raw zlib
 * streams are accepted.
 */
public final class CompressedPayloadDecoder {

    public static final String COMPRESSED_PREFIX = "COMPRESSED_XML:";

    private static final int GZIP_MAGIC_FIRST = 0x1f;
    private static final int GZIP_MAGIC_SECOND = 0x8b;

    private CompressedPayloadDecoder() {
        // Utility class - prevent instantiation
    }

    public static boolean isCompressed(String payload) {
        return payload != null && payload.strip().startsWith(COMPRESSED_PREFIX);
    }

    /**
     * Strips the prefix, decodes base64 and inflates the result.
     *
     * @throws IOException when the data is not valid base64 or not a gzip/zlib stream
     */
    public static String decode(String payload) throws IOException {
        String base64 = payload.strip();
        if (base64.startsWith(COMPRESSED_PREFIX)) {
            base64 = base64.substring(COMPRESSED_PREFIX.length());
        }

        byte[] compressed;
        try {
            compressed = Base64.getMimeDecoder().decode(base64.strip());
        } catch (IllegalArgumentException e) {
            throw new IOException("Compressed payload is not valid base64", e);
        }
        if (compressed.length == 0) {
            throw new IOException("Compressed payload is empty");
        }

        try (InputStream in = openStream(compressed)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static InputStream openStream(byte[] compressed) throws IOException {
        ByteArrayInputStream bytes = new ByteArrayInputStream(compressed);
        boolean gzip = compressed.length > 1
                && (compressed[0] & 0xff) == GZIP_MAGIC_FIRST
                && (compressed[1] & 0xff) == GZIP_MAGIC_SECOND;
        return gzip ? new GZIPInputStream(bytes) : new InflaterInputStream(bytes);
    }
}

package io.veraaws.server.core;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Reads request bodies into memory, enforcing a maximum size.
 */
final class BodyReader {

    private BodyReader() {}

    /**
     * @return the body bytes, empty for a {@code null} stream
     * @throws PayloadTooLargeException if more than {@code maxBytes} bytes are available
     */
    static byte[] readAll(InputStream in, long maxBytes) throws IOException {
        if (in == null) return new byte[0];
        try (InputStream body = in) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] buf = new byte[8192];
            long total = 0;
            int n;
            while ((n = body.read(buf)) >= 0) {
                total += n;
                if (total > maxBytes) throw new PayloadTooLargeException(maxBytes);
                out.write(buf, 0, n);
            }
            return out.toByteArray();
        }
    }

    /**
     * Exception thrown when payload size exceeds the configured limit.
     */
    static final class PayloadTooLargeException extends IOException {
        private final long maxBytes;

        PayloadTooLargeException(long maxBytes) {
            super("Payload exceeds maximum size of " + maxBytes + " bytes");
            this.maxBytes = maxBytes;
        }

        long maxBytes() {
            return maxBytes;
        }
    }
}

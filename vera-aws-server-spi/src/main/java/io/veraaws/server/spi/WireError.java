package io.veraaws.server.spi;

import java.util.Objects;

/**
 * Error to be rendered in a protocol's error envelope.
 */
public record WireError(String code, String message, int httpStatus) {
    public WireError {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
    }

    /** Query protocol fault attribution. */
    public String faultType() {
        return httpStatus >= 500 ? "Receiver" : "Sender";
    }
}

package io.veraaws.server.spi;

/**
 * Raised when a wire codec fails to write a response document.
 */
public class WireCodecException extends RuntimeException {
    public WireCodecException(String message) {
        super(message);
    }

    public WireCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}

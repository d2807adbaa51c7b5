package io.veraaws.server.spi;

import io.veraaws.core.ValueTree;

/**
 * Encodes handler bodies into a protocol's response format and decodes structured request bodies.
 *
 * <p>A codec serves one response content type. Member casing, list element names and envelopes
 * come from the {@link ServiceProtocol} of the {@link ServiceDefinition} passed in.
 */
public interface WireCodec {

    /** Base content type served, e.g. {@code text/xml}. */
    String contentType();

    byte[] encodeResult(ServiceDefinition service, String action, ValueTree.Mapping body, String requestId);

    byte[] encodeError(ServiceDefinition service, WireError error, String requestId);

    /**
     * Decode a structured request document.
     *
     * @throws io.veraaws.core.AwsException.MalformedParameter if the body is not a valid document
     * @throws UnsupportedOperationException if this codec only encodes
     */
    default ValueTree.Mapping decodeBody(byte[] body) {
        throw new UnsupportedOperationException(contentType() + " codec does not decode request bodies");
    }
}

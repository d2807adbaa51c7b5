package io.veraaws.server.core;

import io.veraaws.core.Headers;
import io.veraaws.core.Protocol;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Gateway answer: status, headers and an encoded result or error envelope.
 *
 * <p>Every response produced by {@link AwsGateway} carries the request id header.
 */
public final class ServerResponse {
    private final int status;
    private final Map<String, List<String>> headers = new LinkedHashMap<>();
    private final ResponseBody body;

    public ServerResponse(int status, ResponseBody body) {
        this.status = status;
        this.body = body;
    }

    /** Encoded envelope with its content type and request id. */
    static ServerResponse encoded(int status, String contentType, byte[] envelope, String requestId) {
        return new ServerResponse(status, new ResponseBody.Bytes(envelope))
                .header(Protocol.H_CONTENT_TYPE, contentType)
                .header(Protocol.H_REQUEST_ID, requestId);
    }

    static ServerResponse methodNotAllowed(String requestId) {
        return new ServerResponse(405, new ResponseBody.Empty())
                .header("Allow", "GET, POST")
                .header(Protocol.H_REQUEST_ID, requestId);
    }

    public int status() {
        return status;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public ResponseBody body() {
        return body;
    }

    /** First value of {@code name}, matched case-insensitively. */
    public Optional<String> header(String name) {
        return Headers.firstValue(headers, name);
    }

    public Optional<String> requestId() {
        return header(Protocol.H_REQUEST_ID);
    }

    public ServerResponse header(String name, String value) {
        headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        return this;
    }
}

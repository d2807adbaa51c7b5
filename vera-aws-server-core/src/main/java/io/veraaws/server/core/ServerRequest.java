package io.veraaws.server.core;

import io.veraaws.core.Headers;
import io.veraaws.core.Protocol;

import java.io.InputStream;
import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One provider API call as handed over by the HTTP runtime.
 *
 * <p>Header names are matched case-insensitively. The body is read at most once, by the gateway.
 */
public final class ServerRequest {
    private final HttpMethod method;
    private final URI uri;
    private final Map<String, List<String>> headers;
    private final InputStream body; // may be null

    public ServerRequest(HttpMethod method, URI uri, Map<String, List<String>> headers, InputStream body) {
        this.method = Objects.requireNonNull(method, "method");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.headers = Objects.requireNonNull(headers, "headers");
        this.body = body;
    }

    public HttpMethod method() {
        return method;
    }

    public URI uri() {
        return uri;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public InputStream body() {
        return body;
    }

    /** Only {@code GET} and {@code POST} carry API calls. */
    public boolean isApiMethod() {
        return method == HttpMethod.GET || method == HttpMethod.POST;
    }

    public Optional<String> header(String name) {
        return Headers.firstValue(headers, name);
    }

    /** Trimmed {@code X-Amz-Target} value of a JSON-protocol call. */
    public Optional<String> target() {
        return header(Protocol.H_AMZ_TARGET).map(String::trim).filter(t -> !t.isEmpty());
    }

    /** Service from the SigV4 credential scope. */
    public Optional<String> signedService() {
        return Headers.signedService(headers);
    }

    /** Region from the SigV4 credential scope. */
    public Optional<String> signedRegion() {
        return Headers.signedRegion(headers);
    }

    /** True when the body holds form-encoded parameters; a missing content type counts as form. */
    public boolean hasFormBody() {
        String ct = header(Protocol.H_CONTENT_TYPE).orElse(Protocol.CT_FORM);
        return ct.toLowerCase(Locale.ROOT).startsWith(Protocol.CT_FORM);
    }

    /** Decoded URI query parameters. */
    public Map<String, List<String>> queryParameters() {
        return QueryString.parse(uri);
    }
}

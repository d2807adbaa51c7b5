package io.veraaws.core;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal helpers for case-insensitive protocol header lookup.
 */
public final class Headers {
    private Headers() {}

    public static Optional<String> firstValue(Map<String, ? extends Iterable<String>> headers, String name) {
        if (headers == null || name == null) return Optional.empty();
        String target = name.toLowerCase(Locale.ROOT);

        for (Map.Entry<String, ? extends Iterable<String>> e : headers.entrySet()) {
            if (e.getKey() == null) continue;
            if (e.getKey().toLowerCase(Locale.ROOT).equals(target)) {
                Iterable<String> vals = e.getValue();
                if (vals == null) return Optional.empty();
                for (String v : vals) {
                    if (v != null) return Optional.of(v);
                }
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Extracts the service name from a SigV4 {@code Authorization} header.
     *
     * <p>The credential scope has the form {@code AKID/20240101/us-east-1/ec2/aws4_request}.
     */
    public static Optional<String> signedService(Map<String, ? extends Iterable<String>> headers) {
        Optional<String> auth = firstValue(headers, Protocol.H_AUTHORIZATION);
        if (auth.isEmpty()) return Optional.empty();
        String value = auth.get();
        int idx = value.indexOf("Credential=");
        if (idx < 0) return Optional.empty();
        int end = value.indexOf(',', idx);
        String credential = value.substring(idx + "Credential=".length(), end < 0 ? value.length() : end).trim();
        String[] scope = credential.split("/");
        if (scope.length < 5) return Optional.empty();
        return Optional.of(scope[3].toLowerCase(Locale.ROOT));
    }

    /** Region from the SigV4 credential scope, when present. */
    public static Optional<String> signedRegion(Map<String, ? extends Iterable<String>> headers) {
        Optional<String> auth = firstValue(headers, Protocol.H_AUTHORIZATION);
        if (auth.isEmpty()) return Optional.empty();
        String value = auth.get();
        int idx = value.indexOf("Credential=");
        if (idx < 0) return Optional.empty();
        int end = value.indexOf(',', idx);
        String[] scope = value.substring(idx + "Credential=".length(), end < 0 ? value.length() : end).trim().split("/");
        if (scope.length < 5) return Optional.empty();
        return Optional.of(scope[2]);
    }
}

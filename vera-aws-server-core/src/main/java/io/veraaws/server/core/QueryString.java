package io.veraaws.server.core;

import io.veraaws.core.AwsException;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parser for {@code application/x-www-form-urlencoded} pairs, from a URI query or a request body.
 */
public final class QueryString {
    private QueryString() {}

    public static Map<String, List<String>> parse(URI uri) {
        return parse(uri.getRawQuery());
    }

    /**
     * Decodes raw {@code k=v&k2=v2} text. Keys keep first-arrival order; a key given twice keeps
     * both values in arrival order.
     *
     * @throws AwsException.MalformedParameter if a key or value carries a malformed percent escape
     */
    public static Map<String, List<String>> parse(String raw) {
        if (raw == null || raw.isEmpty()) return Map.of();
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (String part : raw.split("&")) {
            if (part.isEmpty()) continue;
            int eq = part.indexOf('=');
            String k = decode(eq < 0 ? part : part.substring(0, eq));
            String v = eq < 0 ? "" : decode(part.substring(eq + 1));
            out.computeIfAbsent(k, x -> new ArrayList<>()).add(v);
        }
        return out;
    }

    private static String decode(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new AwsException.MalformedParameter("Malformed URL encoding in '" + s + "'");
        }
    }
}

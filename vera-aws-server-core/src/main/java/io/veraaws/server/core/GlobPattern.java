package io.veraaws.server.core;

/**
 * Provider filter value matching: {@code *} matches zero or more characters, {@code ?} exactly one.
 *
 * <p>A value without wildcards matches only on exact equality.
 */
public final class GlobPattern {
    private GlobPattern() {}

    public static boolean isGlob(String pattern) {
        return pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0;
    }

    public static boolean matches(String pattern, String text) {
        if (pattern == null || text == null) return false;
        if (!isGlob(pattern)) return pattern.equals(text);

        int p = 0;
        int t = 0;
        int star = -1;
        int mark = 0;
        while (t < text.length()) {
            if (p < pattern.length() && (pattern.charAt(p) == '?' || pattern.charAt(p) == text.charAt(t))) {
                p++;
                t++;
            } else if (p < pattern.length() && pattern.charAt(p) == '*') {
                star = p++;
                mark = t;
            } else if (star >= 0) {
                p = star + 1;
                t = ++mark;
            } else {
                return false;
            }
        }
        while (p < pattern.length() && pattern.charAt(p) == '*') p++;
        return p == pattern.length();
    }
}

package io.veraaws.server.core;

import io.veraaws.core.ValueTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Dotted path into a resource attribute tree, e.g. {@code attachmentSet.instanceId}.
 *
 * <p>Resolution fans out across sequences: every element of a sequence met along the way is
 * followed, so a path can yield many values.
 */
public final class AttributePath {
    private final String raw;
    private final String[] segments;

    private AttributePath(String raw) {
        this.raw = raw;
        this.segments = raw.split("\\.");
    }

    public static AttributePath parse(String raw) {
        Objects.requireNonNull(raw, "raw");
        if (raw.isBlank() || raw.startsWith(".") || raw.endsWith(".") || raw.contains("..")) {
            throw new IllegalArgumentException("invalid attribute path: " + raw);
        }
        return new AttributePath(raw);
    }

    /** Textual values of all scalars reached by this path. */
    public List<String> resolve(ValueTree.Mapping root) {
        List<String> out = new ArrayList<>();
        collect(root, 0, out);
        return out;
    }

    private void collect(ValueTree node, int depth, List<String> out) {
        if (node == null) return;
        if (node instanceof ValueTree.Sequence seq) {
            for (ValueTree item : seq.items()) collect(item, depth, out);
            return;
        }
        if (depth == segments.length) {
            if (node instanceof ValueTree.Scalar s) out.add(s.asText());
            return;
        }
        if (node instanceof ValueTree.Mapping m) {
            collect(m.get(segments[depth]), depth + 1, out);
        }
    }

    @Override
    public String toString() {
        return raw;
    }
}

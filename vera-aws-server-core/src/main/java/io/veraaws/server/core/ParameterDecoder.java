package io.veraaws.server.core;

import io.veraaws.core.AwsException;
import io.veraaws.core.ValueTree;
import io.veraaws.server.spi.ServiceProtocol;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Rebuilds nested parameters from flat query keys.
 *
 * <p>Keys are dot separated. A numeric segment is a 1-based position in a sequence, any other
 * segment a mapping member: {@code Filter.1.Value.2=x} becomes
 * {@code {Filter: [{Value: [_, x]}]}}. The protocol's list marker ({@code member} for the query
 * protocol) and the map marker {@code entry} are dropped when followed by an index.
 *
 * <p>The result does not depend on the order in which keys arrive. A key that addresses an existing
 * node with a different shape, a zero or zero-padded index, or (unless the protocol allows sparse
 * indices) a gap in a sequence is rejected with {@link AwsException.MalformedParameter}.
 */
public final class ParameterDecoder {

    private static final String MAP_MARKER = "entry";

    private final ServiceProtocol protocol;

    public ParameterDecoder(ServiceProtocol protocol) {
        this.protocol = protocol;
    }

    public ValueTree.Mapping decode(Map<String, List<String>> raw) {
        MapNode root = new MapNode("");
        List<String> keys = new ArrayList<>(raw.keySet());
        keys.sort(null);
        for (String key : keys) {
            List<String> values = raw.get(key);
            if (values == null || values.isEmpty()) continue;
            insert(root, key, values.get(values.size() - 1));
        }
        return (ValueTree.Mapping) root.toTree(protocol.allowSparseIndices());
    }

    private void insert(MapNode root, String key, String value) {
        List<String> segments = segments(key);
        Node cursor = root;
        for (int i = 0; i < segments.size(); i++) {
            String seg = segments.get(i);
            boolean last = i == segments.size() - 1;
            String path = String.join(".", segments.subList(0, i + 1));

            Node child;
            if (cursor instanceof MapNode m) {
                if (isIndex(seg)) throw malformed(key, path + " addresses a structure by position");
                child = m.children.get(seg);
            } else {
                ListNode l = (ListNode) cursor;
                if (!isIndex(seg)) throw malformed(key, path + " addresses a list by name");
                child = l.items.get(index(key, seg));
            }

            if (last) {
                if (child != null && !(child instanceof LeafNode)) {
                    throw malformed(key, path + " is both a value and a structure");
                }
                attach(cursor, seg, new LeafNode(value), key);
                return;
            }

            boolean nextIsIndex = isIndex(segments.get(i + 1));
            if (child == null) {
                child = nextIsIndex ? new ListNode(path) : new MapNode(path);
                attach(cursor, seg, child, key);
            } else if (child instanceof LeafNode
                    || (nextIsIndex && !(child instanceof ListNode))
                    || (!nextIsIndex && !(child instanceof MapNode))) {
                throw malformed(key, path + " is used with conflicting shapes");
            }
            cursor = child;
        }
    }

    private void attach(Node parent, String seg, Node child, String key) {
        if (parent instanceof MapNode m) {
            m.children.put(seg, child);
        } else {
            ((ListNode) parent).items.put(index(key, seg), child);
        }
    }

    private List<String> segments(String key) {
        String[] parts = key.split("\\.", -1);
        List<String> out = new ArrayList<>(parts.length);
        for (int i = 0; i < parts.length; i++) {
            String p = parts[i];
            if (p.isEmpty()) throw malformed(key, "empty segment");
            boolean marker = p.equals(protocol.listMarker()) || p.equals(MAP_MARKER);
            if (marker && i > 0 && i + 1 < parts.length && isIndex(parts[i + 1])) continue;
            out.add(p);
        }
        if (isIndex(out.get(0))) throw malformed(key, "key must start with a name");
        return out;
    }

    private static boolean isIndex(String seg) {
        for (int i = 0; i < seg.length(); i++) {
            if (!Character.isDigit(seg.charAt(i))) return false;
        }
        return !seg.isEmpty();
    }

    private static int index(String key, String seg) {
        if (seg.length() > 1 && seg.charAt(0) == '0') throw malformed(key, "index " + seg + " is zero-padded");
        int idx;
        try {
            idx = Integer.parseInt(seg);
        } catch (NumberFormatException e) {
            throw malformed(key, "index " + seg + " is out of range");
        }
        if (idx < 1) throw malformed(key, "indices start at 1");
        return idx;
    }

    private static AwsException.MalformedParameter malformed(String key, String reason) {
        return new AwsException.MalformedParameter("Malformed parameter " + key + ": " + reason);
    }

    private interface Node {
        ValueTree toTree(boolean allowSparse);
    }

    private record LeafNode(String value) implements Node {
        @Override
        public ValueTree toTree(boolean allowSparse) {
            return ValueTree.of(value);
        }
    }

    private static final class MapNode implements Node {
        private final String path;
        private final Map<String, Node> children = new LinkedHashMap<>();

        MapNode(String path) {
            this.path = path;
        }

        @Override
        public ValueTree toTree(boolean allowSparse) {
            ValueTree.Mapping.Builder b = ValueTree.Mapping.builder();
            for (Map.Entry<String, Node> e : children.entrySet()) {
                b.put(e.getKey(), e.getValue().toTree(allowSparse));
            }
            return b.build();
        }

        @Override
        public String toString() {
            return path;
        }
    }

    private static final class ListNode implements Node {
        private final String path;
        private final TreeMap<Integer, Node> items = new TreeMap<>();

        ListNode(String path) {
            this.path = path;
        }

        @Override
        public ValueTree toTree(boolean allowSparse) {
            List<ValueTree> out = new ArrayList<>(items.size());
            int expected = 1;
            for (Map.Entry<Integer, Node> e : items.entrySet()) {
                if (!allowSparse && e.getKey() != expected) {
                    throw new AwsException.MalformedParameter(
                            "Malformed parameter " + path + "." + expected + ": missing list element");
                }
                out.add(e.getValue().toTree(allowSparse));
                expected++;
            }
            return new ValueTree.Sequence(out);
        }
    }
}

package io.veraaws.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Generic nested value used for decoded request parameters, resource attributes and response bodies.
 *
 * <p>A tree is either a {@link Scalar}, an ordered {@link Mapping} or a {@link Sequence}. Trees are
 * immutable; "modifying" operations return new instances.
 */
public sealed interface ValueTree permits ValueTree.Scalar, ValueTree.Mapping, ValueTree.Sequence {

    /**
     * Textual form of a scalar, empty for mappings and sequences.
     */
    default Optional<String> text() {
        return Optional.empty();
    }

    static Scalar of(String value) {
        return new Scalar(value);
    }

    static Scalar of(boolean value) {
        return new Scalar(value);
    }

    static Scalar of(long value) {
        return new Scalar(value);
    }

    /**
     * Leaf value. Holds a {@link String}, {@link Boolean} or {@link Number}.
     */
    record Scalar(Object value) implements ValueTree {
        public Scalar {
            Objects.requireNonNull(value, "value");
            if (!(value instanceof String || value instanceof Boolean || value instanceof Number)) {
                throw new IllegalArgumentException("unsupported scalar type: " + value.getClass().getName());
            }
        }

        public String asText() {
            return value.toString();
        }

        @Override
        public Optional<String> text() {
            return Optional.of(asText());
        }
    }

    /**
     * Ordered string-keyed mapping. Iteration follows insertion order.
     */
    record Mapping(Map<String, ValueTree> fields) implements ValueTree {
        private static final Mapping EMPTY = new Mapping(Map.of());

        public Mapping {
            Objects.requireNonNull(fields, "fields");
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        public static Mapping empty() {
            return EMPTY;
        }

        public static Builder builder() {
            return new Builder();
        }

        public boolean isEmpty() {
            return fields.isEmpty();
        }

        public boolean has(String key) {
            return fields.containsKey(key);
        }

        public ValueTree get(String key) {
            return fields.get(key);
        }

        public Optional<String> text(String key) {
            ValueTree v = fields.get(key);
            return v == null ? Optional.empty() : v.text();
        }

        public Optional<Mapping> mapping(String key) {
            ValueTree v = fields.get(key);
            return v instanceof Mapping m ? Optional.of(m) : Optional.empty();
        }

        /**
         * Elements of a sequence field. A scalar or mapping is treated as a one-element sequence,
         * an absent field as an empty one.
         */
        public List<ValueTree> sequence(String key) {
            ValueTree v = fields.get(key);
            if (v == null) return List.of();
            if (v instanceof Sequence s) return s.items();
            return List.of(v);
        }

        public Mapping with(String key, ValueTree value) {
            Map<String, ValueTree> copy = new LinkedHashMap<>(fields);
            copy.put(key, value);
            return new Mapping(copy);
        }

        public Mapping without(String key) {
            if (!fields.containsKey(key)) return this;
            Map<String, ValueTree> copy = new LinkedHashMap<>(fields);
            copy.remove(key);
            return new Mapping(copy);
        }

        /**
         * Builder preserving insertion order; {@code null} values are skipped so optional members
         * can be passed through unconditionally.
         */
        public static final class Builder {
            private final Map<String, ValueTree> fields = new LinkedHashMap<>();

            private Builder() {}

            public Builder put(String key, ValueTree value) {
                Objects.requireNonNull(key, "key");
                if (value != null) fields.put(key, value);
                return this;
            }

            public Builder put(String key, String value) {
                return put(key, value == null ? null : ValueTree.of(value));
            }

            public Builder put(String key, boolean value) {
                return put(key, ValueTree.of(value));
            }

            public Builder put(String key, long value) {
                return put(key, ValueTree.of(value));
            }

            public Builder putAll(Mapping other) {
                fields.putAll(other.fields());
                return this;
            }

            public Mapping build() {
                return new Mapping(fields);
            }
        }
    }

    /**
     * Ordered sequence of values.
     */
    record Sequence(List<ValueTree> items) implements ValueTree {
        public Sequence {
            items = List.copyOf(items);
        }

        public static Sequence of(ValueTree... items) {
            return new Sequence(List.of(items));
        }

        public static Sequence ofTexts(Iterable<String> values) {
            List<ValueTree> out = new ArrayList<>();
            for (String v : values) out.add(ValueTree.of(v));
            return new Sequence(out);
        }

        public boolean isEmpty() {
            return items.isEmpty();
        }
    }
}

package io.veraaws.server.spi;

import io.veraaws.core.ValueTree;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a stored resource.
 *
 * <p>Tags are keyed by tag key and enumerate in first-assignment order.
 */
public final class Resource {
    private final ResourceType type;
    private final String id;
    private final ValueTree.Mapping attributes;
    private final Map<String, String> tags;
    private final Instant createdAt;
    private final String state;

    public Resource(ResourceType type, String id, ValueTree.Mapping attributes, Map<String, String> tags, Instant createdAt, String state) {
        this.type = Objects.requireNonNull(type, "type");
        this.id = Objects.requireNonNull(id, "id");
        this.attributes = Objects.requireNonNull(attributes, "attributes");
        this.tags = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(tags, "tags")));
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.state = state;
    }

    public ResourceType type() {
        return type;
    }

    public String id() {
        return id;
    }

    public ValueTree.Mapping attributes() {
        return attributes;
    }

    public Optional<String> attribute(String key) {
        return attributes.text(key);
    }

    public Map<String, String> tags() {
        return tags;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /** Lifecycle state; {@code null} for types without one. */
    public String state() {
        return state;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Resource other)) return false;
        return type.equals(other.type)
                && id.equals(other.id)
                && attributes.equals(other.attributes)
                && tags.equals(other.tags)
                && createdAt.equals(other.createdAt)
                && Objects.equals(state, other.state);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, id);
    }

    @Override
    public String toString() {
        return type.name() + "/" + id;
    }
}

package io.veraaws.server.spi;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Closed set of resource types known to a store, built once at startup.
 *
 * <p>The builder checks that every reference and cascade names a registered type, so a typo in a
 * type declaration fails at boot rather than on the first request that touches it.
 */
public final class ResourceTypeRegistry {

    private final Map<String, ResourceType> byName;

    private ResourceTypeRegistry(Map<String, ResourceType> byName) {
        this.byName = Collections.unmodifiableMap(new LinkedHashMap<>(byName));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<ResourceType> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public ResourceType require(String name) {
        ResourceType t = byName.get(name);
        if (t == null) throw new IllegalArgumentException("unknown resource type: " + name);
        return t;
    }

    public boolean contains(ResourceType type) {
        return type != null && byName.get(type.name()) == type;
    }

    public Collection<ResourceType> all() {
        return byName.values();
    }

    /**
     * Builder for {@link ResourceTypeRegistry}.
     */
    public static final class Builder {
        private final Map<String, ResourceType> types = new LinkedHashMap<>();

        private Builder() {}

        public Builder register(ResourceType type) {
            Objects.requireNonNull(type, "type");
            if (types.putIfAbsent(type.name(), type) != null) {
                throw new IllegalArgumentException("duplicate resource type: " + type.name());
            }
            return this;
        }

        public Builder registerAll(Iterable<ResourceType> types) {
            for (ResourceType t : types) register(t);
            return this;
        }

        public ResourceTypeRegistry build() {
            for (ResourceType t : types.values()) {
                for (String target : t.references().values()) {
                    if (!types.containsKey(target)) {
                        throw new IllegalStateException(t.name() + " references unregistered type " + target);
                    }
                }
                for (String cascade : t.cascades()) {
                    if (!types.containsKey(cascade)) {
                        throw new IllegalStateException(t.name() + " cascades to unregistered type " + cascade);
                    }
                }
            }
            return new ResourceTypeRegistry(types);
        }
    }
}

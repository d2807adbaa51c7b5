package io.veraaws.server.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Declaration of one category of emulated resource.
 *
 * <p>A type fixes the id prefix and suffix length, the valid state values, the attribute paths
 * that hold ids of other resources (reference fields), the provider filter names understood by
 * describe calls, and the referencing types that are removed along with a resource of this type.
 *
 * <p>Use {@link #builder(String)}:
 * <pre>{@code
 * ResourceType subnet = ResourceType.builder("subnet")
 *     .idPrefix("subnet")
 *     .states("available", "pending")
 *     .reference("vpcId", "vpc")
 *     .filter("vpc-id", "vpcId")
 *     .notFoundCode("InvalidSubnetID.NotFound")
 *     .build();
 * }</pre>
 */
public final class ResourceType {

    /** Filter path addressing the resource id instead of an attribute. */
    public static final String ID_PATH = "@id";
    /** Filter path addressing the lifecycle state instead of an attribute. */
    public static final String STATE_PATH = "@state";

    private final String name;
    private final String idPrefix;
    private final IdFormat idFormat;
    private final String initialState;
    private final Set<String> states;
    private final Map<String, String> references;
    private final Map<String, String> filters;
    private final Map<String, Predicate<Resource>> cascades;
    private final String notFoundCode;

    private ResourceType(Builder b) {
        this.name = b.name;
        this.idPrefix = b.idPrefix != null ? b.idPrefix : b.name;
        this.idFormat = b.idFormat;
        this.states = Collections.unmodifiableSet(new LinkedHashSet<>(b.states));
        this.initialState = b.initialState != null ? b.initialState : b.states.isEmpty() ? null : b.states.iterator().next();
        this.references = Collections.unmodifiableMap(new LinkedHashMap<>(b.references));
        this.filters = Collections.unmodifiableMap(new LinkedHashMap<>(b.filters));
        this.cascades = Collections.unmodifiableMap(new LinkedHashMap<>(b.cascades));
        this.notFoundCode = b.notFoundCode != null ? b.notFoundCode : "Invalid" + pascal(b.name) + "ID.NotFound";
        if (initialState != null && !states.contains(initialState)) {
            throw new IllegalArgumentException("initial state " + initialState + " not declared for " + name);
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public String idPrefix() {
        return idPrefix;
    }

    public IdFormat idFormat() {
        return idFormat;
    }

    /** State assigned by the store on create; {@code null} when the type has no lifecycle. */
    public String initialState() {
        return initialState;
    }

    public Set<String> states() {
        return states;
    }

    public boolean isValidState(String state) {
        if (states.isEmpty()) return state == null;
        return state != null && states.contains(state);
    }

    /** Attribute path to the type name of the resource it references. */
    public Map<String, String> references() {
        return references;
    }

    /** Provider filter name to attribute path. */
    public Map<String, String> filters() {
        return filters;
    }

    public Optional<String> filterPath(String filterName) {
        return Optional.ofNullable(filters.get(filterName));
    }

    /** Referencing types that may be deleted together with a resource of this type. */
    public Set<String> cascades() {
        return cascades.keySet();
    }

    /**
     * Whether {@code referrer} is removed along with a resource of this type. A referrer of a
     * cascading type that fails the declared condition blocks the delete like any other.
     */
    public boolean cascadesTo(Resource referrer) {
        Predicate<Resource> condition = cascades.get(referrer.type().name());
        return condition != null && condition.test(referrer);
    }

    public String notFoundCode() {
        return notFoundCode;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResourceType other)) return false;
        return name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }

    private static String pascal(String dashed) {
        StringBuilder sb = new StringBuilder();
        for (String part : dashed.split("-")) {
            if (part.isEmpty()) continue;
            sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        return sb.toString();
    }

    /**
     * Builder for {@link ResourceType}.
     */
    public static final class Builder {
        private final String name;
        private String idPrefix;
        private IdFormat idFormat = IdFormat.LONG;
        private String initialState;
        private final Set<String> states = new LinkedHashSet<>();
        private final Map<String, String> references = new LinkedHashMap<>();
        private final Map<String, String> filters = new LinkedHashMap<>();
        private final Map<String, Predicate<Resource>> cascades = new LinkedHashMap<>();
        private String notFoundCode;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
            if (name.isBlank()) throw new IllegalArgumentException("name must not be blank");
        }

        public Builder idPrefix(String idPrefix) {
            this.idPrefix = Objects.requireNonNull(idPrefix, "idPrefix");
            return this;
        }

        public Builder idFormat(IdFormat idFormat) {
            this.idFormat = Objects.requireNonNull(idFormat, "idFormat");
            return this;
        }

        /** Declares the valid states; the first one is the initial state unless {@link #initialState} is set. */
        public Builder states(String... states) {
            for (String s : states) this.states.add(Objects.requireNonNull(s, "state"));
            return this;
        }

        public Builder initialState(String initialState) {
            this.initialState = initialState;
            return this;
        }

        public Builder reference(String attributePath, String targetType) {
            references.put(Objects.requireNonNull(attributePath, "attributePath"), Objects.requireNonNull(targetType, "targetType"));
            return this;
        }

        public Builder filter(String filterName, String attributePath) {
            filters.put(Objects.requireNonNull(filterName, "filterName"), Objects.requireNonNull(attributePath, "attributePath"));
            return this;
        }

        public Builder cascade(String referencingType) {
            return cascade(referencingType, r -> true);
        }

        /** Cascades only to referrers of {@code referencingType} that satisfy {@code condition}. */
        public Builder cascade(String referencingType, Predicate<Resource> condition) {
            cascades.put(Objects.requireNonNull(referencingType, "referencingType"), Objects.requireNonNull(condition, "condition"));
            return this;
        }

        public Builder notFoundCode(String notFoundCode) {
            this.notFoundCode = notFoundCode;
            return this;
        }

        public ResourceType build() {
            return new ResourceType(this);
        }
    }
}

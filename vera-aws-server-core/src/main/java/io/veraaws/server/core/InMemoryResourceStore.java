package io.veraaws.server.core;

import io.veraaws.core.AwsException;
import io.veraaws.core.ValueTree;
import io.veraaws.server.spi.IdGenerator;
import io.veraaws.server.spi.Resource;
import io.veraaws.server.spi.ResourceEditor;
import io.veraaws.server.spi.ResourceStore;
import io.veraaws.server.spi.ResourceType;
import io.veraaws.server.spi.ResourceTypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * The in-memory {@link ResourceStore}.
 *
 * <p>All state sits behind one read/write lock: reads share it, every mutation (including the
 * delete-time integrity check and the removal it guards) holds the write lock for its whole
 * duration. A create that references a resource being deleted therefore either sees it (and the
 * delete then fails with a dependency violation) or does not (and the create fails with not-found).
 *
 * <p>Reference fields declared by each {@link ResourceType} are indexed on create and update so
 * "who references X" is a map lookup.
 */
public final class InMemoryResourceStore implements ResourceStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryResourceStore.class);

    /** Id allocation attempts before giving up with an internal error. */
    static final int MAX_ID_ATTEMPTS = 16;

    private static final int MAX_TAG_KEY_LENGTH = 128;
    private static final int MAX_TAG_VALUE_LENGTH = 256;
    private static final String RESERVED_TAG_PREFIX = "aws:";

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ResourceTypeRegistry types;
    private final IdGenerator idGenerator;
    private final Clock clock;

    private final Map<ResourceType, LinkedHashMap<String, Resource>> tables = new HashMap<>();
    private final Map<String, ResourceType> typeById = new HashMap<>();
    private final ReferenceIndex references = new ReferenceIndex();
    private final Map<String, AttributePath> paths = new HashMap<>();

    public InMemoryResourceStore(ResourceTypeRegistry types) {
        this(types, new RandomHexIdGenerator(), Clock.systemUTC());
    }

    public InMemoryResourceStore(ResourceTypeRegistry types, IdGenerator idGenerator, Clock clock) {
        this.types = Objects.requireNonNull(types, "types");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
        this.clock = Objects.requireNonNull(clock, "clock");
        for (ResourceType t : types.all()) {
            tables.put(t, new LinkedHashMap<>());
            for (String path : t.references().keySet()) {
                paths.put(path, AttributePath.parse(path));
            }
        }
    }

    @Override
    public Resource create(ResourceType type, ValueTree.Mapping attributes, Map<String, String> tags) {
        Objects.requireNonNull(attributes, "attributes");
        Objects.requireNonNull(tags, "tags");
        LinkedHashMap<String, Resource> table = table(type);
        Map<String, String> initialTags = new LinkedHashMap<>();
        tags.forEach((k, v) -> initialTags.put(k, v == null ? "" : v));
        validateTags(initialTags);

        lock.writeLock().lock();
        try {
            Set<String> refs = checkedReferences(type, attributes, null);
            String id = allocateId(type);
            Resource r = new Resource(type, id, attributes, initialTags, clock.instant(), type.initialState());
            table.put(id, r);
            typeById.put(id, type);
            references.add(id, refs);
            log.debug("Created {} {}", type.name(), id);
            return r;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Resource get(ResourceType type, String id) {
        return find(type, id).orElseThrow(() -> notFound(type, id));
    }

    @Override
    public Optional<Resource> find(ResourceType type, String id) {
        LinkedHashMap<String, Resource> table = table(type);
        if (id == null) return Optional.empty();
        lock.readLock().lock();
        try {
            return Optional.ofNullable(table.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Resource> lookup(String id) {
        if (id == null) return Optional.empty();
        lock.readLock().lock();
        try {
            ResourceType type = typeById.get(id);
            return type == null ? Optional.empty() : Optional.ofNullable(tables.get(type).get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Resource> list(ResourceType type) {
        LinkedHashMap<String, Resource> table = table(type);
        lock.readLock().lock();
        try {
            return List.copyOf(table.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Resource update(ResourceType type, String id, Consumer<ResourceEditor> mutator) {
        Objects.requireNonNull(mutator, "mutator");
        LinkedHashMap<String, Resource> table = table(type);

        lock.writeLock().lock();
        try {
            Resource current = table.get(id);
            if (current == null) throw notFound(type, id);

            Draft draft = new Draft(current);
            mutator.accept(draft);

            if (!type.isValidState(draft.state)) {
                throw new AwsException.Internal("state " + draft.state + " is not valid for " + type.name());
            }
            validateTags(draft.tags);
            ValueTree.Mapping attributes = draft.attributes;
            Set<String> newRefs = checkedReferences(type, attributes, id);
            Set<String> oldRefs = referenceIds(type, current.attributes());

            Resource updated = new Resource(type, id, attributes, draft.tags, current.createdAt(), draft.state);
            table.put(id, updated);
            references.remove(id, oldRefs);
            references.add(id, newRefs);
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void delete(ResourceType type, String id) {
        LinkedHashMap<String, Resource> table = table(type);

        lock.writeLock().lock();
        try {
            if (!table.containsKey(id)) throw notFound(type, id);

            Map<String, ResourceType> plan = new LinkedHashMap<>();
            planRemoval(type, id, plan);
            for (Map.Entry<String, ResourceType> e : plan.entrySet()) {
                Resource removed = tables.get(e.getValue()).remove(e.getKey());
                typeById.remove(e.getKey());
                references.remove(e.getKey(), referenceIds(e.getValue(), removed.attributes()));
            }
            if (plan.size() > 1) {
                log.debug("Deleted {} {} with cascaded {}", type.name(), id, plan.keySet());
            } else {
                log.debug("Deleted {} {}", type.name(), id);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Resource tagResource(String id, Map<String, String> tags) {
        Objects.requireNonNull(tags, "tags");
        return update(typeOf(id), id, editor -> tags.forEach(editor::tag));
    }

    @Override
    public Resource untagResource(String id, Collection<String> keys) {
        Objects.requireNonNull(keys, "keys");
        return update(typeOf(id), id, editor -> keys.forEach(editor::untag));
    }

    @Override
    public Set<String> referencesTo(String id) {
        lock.readLock().lock();
        try {
            return references.referrersOf(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public ResourceTypeRegistry types() {
        return types;
    }

    private void planRemoval(ResourceType type, String id, Map<String, ResourceType> plan) {
        plan.put(id, type);
        for (String referrer : references.referrersOf(id)) {
            if (plan.containsKey(referrer) || referrer.equals(id)) continue;
            ResourceType referrerType = typeById.get(referrer);
            Resource dependent = referrerType == null ? null : tables.get(referrerType).get(referrer);
            if (dependent == null || !type.cascadesTo(dependent)) {
                throw new AwsException.DependencyViolation(type.name(), id);
            }
            planRemoval(referrerType, referrer, plan);
        }
    }

    private ResourceType typeOf(String id) {
        lock.readLock().lock();
        try {
            ResourceType type = typeById.get(id);
            if (type != null) return type;
        } finally {
            lock.readLock().unlock();
        }
        for (ResourceType t : types.all()) {
            if (id != null && id.startsWith(t.idPrefix() + "-")) throw notFound(t, id);
        }
        throw new AwsException.NotFound("InvalidID", "resource", String.valueOf(id));
    }

    private String allocateId(ResourceType type) {
        for (int attempt = 0; attempt < MAX_ID_ATTEMPTS; attempt++) {
            String candidate = idGenerator.next(type);
            if (candidate != null && !typeById.containsKey(candidate)) return candidate;
        }
        throw new AwsException.Internal("could not allocate an unused " + type.name() + " id after " + MAX_ID_ATTEMPTS + " attempts");
    }

    private Set<String> checkedReferences(ResourceType type, ValueTree.Mapping attributes, String selfId) {
        Set<String> ids = new LinkedHashSet<>();
        for (Map.Entry<String, String> ref : type.references().entrySet()) {
            ResourceType target = types.require(ref.getValue());
            for (String value : paths.get(ref.getKey()).resolve(attributes)) {
                if (value.isEmpty() || value.equals(selfId)) continue;
                if (!tables.get(target).containsKey(value)) throw notFound(target, value);
                ids.add(value);
            }
        }
        return ids;
    }

    private Set<String> referenceIds(ResourceType type, ValueTree.Mapping attributes) {
        Set<String> ids = new LinkedHashSet<>();
        for (String path : type.references().keySet()) {
            for (String value : paths.get(path).resolve(attributes)) {
                if (!value.isEmpty()) ids.add(value);
            }
        }
        return ids;
    }

    private LinkedHashMap<String, Resource> table(ResourceType type) {
        Objects.requireNonNull(type, "type");
        LinkedHashMap<String, Resource> table = tables.get(type);
        if (table == null || !types.contains(type)) {
            throw new IllegalArgumentException("resource type not registered with this store: " + type.name());
        }
        return table;
    }

    private static void validateTags(Map<String, String> tags) {
        for (Map.Entry<String, String> e : tags.entrySet()) {
            String key = e.getKey();
            if (key == null || key.isEmpty() || key.length() > MAX_TAG_KEY_LENGTH) {
                throw new AwsException.ValidationFailed("InvalidParameterValue", "Tag key must be between 1 and " + MAX_TAG_KEY_LENGTH + " characters");
            }
            if (key.regionMatches(true, 0, RESERVED_TAG_PREFIX, 0, RESERVED_TAG_PREFIX.length())) {
                throw new AwsException.ValidationFailed("InvalidParameterValue", "Tag keys starting with 'aws:' are reserved for internal use");
            }
            String value = e.getValue();
            if (value != null && value.length() > MAX_TAG_VALUE_LENGTH) {
                throw new AwsException.ValidationFailed("InvalidParameterValue", "Tag value must be at most " + MAX_TAG_VALUE_LENGTH + " characters");
            }
        }
    }

    private static AwsException.NotFound notFound(ResourceType type, String id) {
        return new AwsException.NotFound(type.notFoundCode(), type.name(), String.valueOf(id));
    }

    private static final class Draft implements ResourceEditor {
        private final String id;
        private ValueTree.Mapping attributes;
        private String state;
        private final Map<String, String> tags;

        private Draft(Resource current) {
            this.id = current.id();
            this.attributes = current.attributes();
            this.state = current.state();
            this.tags = new LinkedHashMap<>(current.tags());
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public ValueTree.Mapping attributes() {
            return attributes;
        }

        @Override
        public ResourceEditor set(String key, ValueTree value) {
            Objects.requireNonNull(value, "value");
            attributes = attributes.with(key, value);
            return this;
        }

        @Override
        public ResourceEditor remove(String key) {
            attributes = attributes.without(key);
            return this;
        }

        @Override
        public String state() {
            return state;
        }

        @Override
        public ResourceEditor state(String state) {
            this.state = state;
            return this;
        }

        @Override
        public Map<String, String> tags() {
            return Collections.unmodifiableMap(tags);
        }

        @Override
        public ResourceEditor tag(String key, String value) {
            tags.put(key, value == null ? "" : value);
            return this;
        }

        @Override
        public ResourceEditor untag(String key) {
            tags.remove(key);
            return this;
        }
    }

    // package-private for tests
    int indexedTargets() {
        lock.readLock().lock();
        try {
            return references.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}

package io.veraaws.server.core;

import io.veraaws.server.spi.FilterSpec;
import io.veraaws.server.spi.Resource;
import io.veraaws.server.spi.ResourceFilter;
import io.veraaws.server.spi.ResourceType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stateless implementation of the provider's describe filter semantics.
 *
 * <p>Filter names resolve as follows:
 * <ul>
 *   <li>{@code tag:<Key>}: the value of tag {@code Key}</li>
 *   <li>{@code tag-key} / {@code tag-value}: every tag key / value of the resource</li>
 *   <li>anything else: the attribute path the resource type declares for that name, where the
 *       pseudo paths {@value #ID_PATH} and {@value #STATE_PATH} address the id and lifecycle state</li>
 * </ul>
 * Names the type does not declare match nothing.
 */
public final class FilterEvaluator implements ResourceFilter {

    public static final String ID_PATH = ResourceType.ID_PATH;
    public static final String STATE_PATH = ResourceType.STATE_PATH;

    private static final String TAG_PREFIX = "tag:";
    private static final String TAG_KEY = "tag-key";
    private static final String TAG_VALUE = "tag-value";

    private final Map<String, AttributePath> paths = new ConcurrentHashMap<>();

    @Override
    public boolean evaluate(Resource resource, List<FilterSpec> filters) {
        for (FilterSpec filter : filters) {
            if (!matches(resource, filter)) return false;
        }
        return true;
    }

    @Override
    public List<Resource> evaluateAll(List<Resource> resources, List<FilterSpec> filters) {
        if (filters.isEmpty()) return List.copyOf(resources);
        List<Resource> out = new ArrayList<>();
        for (Resource r : resources) {
            if (evaluate(r, filters)) out.add(r);
        }
        return out;
    }

    private boolean matches(Resource resource, FilterSpec filter) {
        Optional<List<String>> candidates = candidates(resource, filter.name());
        if (candidates.isEmpty()) return false;
        for (String candidate : candidates.get()) {
            for (String pattern : filter.values()) {
                if (GlobPattern.matches(pattern, candidate)) return true;
            }
        }
        return false;
    }

    private Optional<List<String>> candidates(Resource resource, String name) {
        if (name.startsWith(TAG_PREFIX)) {
            String value = resource.tags().get(name.substring(TAG_PREFIX.length()));
            return Optional.of(value == null ? List.of() : List.of(value));
        }
        if (TAG_KEY.equals(name)) return Optional.of(List.copyOf(resource.tags().keySet()));
        if (TAG_VALUE.equals(name)) return Optional.of(List.copyOf(resource.tags().values()));

        Optional<String> path = resource.type().filterPath(name);
        if (path.isEmpty()) return Optional.empty();
        String p = path.get();
        if (ID_PATH.equals(p)) return Optional.of(List.of(resource.id()));
        if (STATE_PATH.equals(p)) {
            return Optional.of(resource.state() == null ? List.of() : List.of(resource.state()));
        }
        return Optional.of(paths.computeIfAbsent(p, AttributePath::parse).resolve(resource.attributes()));
    }
}

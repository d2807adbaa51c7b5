package io.veraaws.server.spi;

import io.veraaws.core.ValueTree;

import java.util.Map;

/**
 * Mutable view of a resource handed to an {@link ResourceStore#update} mutator.
 *
 * <p>Changes are applied to a private draft and become visible only when the mutator returns
 * without throwing.
 */
public interface ResourceEditor {

    String id();

    ValueTree.Mapping attributes();

    ResourceEditor set(String key, ValueTree value);

    default ResourceEditor set(String key, String value) {
        return set(key, ValueTree.of(value));
    }

    ResourceEditor remove(String key);

    String state();

    ResourceEditor state(String state);

    Map<String, String> tags();

    ResourceEditor tag(String key, String value);

    ResourceEditor untag(String key);
}

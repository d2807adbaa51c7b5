package io.veraaws.server.spi;

import io.veraaws.core.AwsException;
import io.veraaws.core.ValueTree;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Owner of all resource state.
 *
 * <p>Handlers create, mutate and remove resources only through this contract so that id
 * allocation, referential integrity and tag semantics are enforced in one place. Every operation
 * is atomic with respect to every other operation.
 */
public interface ResourceStore {

    /**
     * Create a resource with a freshly allocated id and the type's initial state.
     *
     * @throws AwsException.NotFound if a declared reference field names a missing resource
     * @throws AwsException.Internal if no unused id could be allocated
     */
    Resource create(ResourceType type, ValueTree.Mapping attributes, Map<String, String> tags);

    /**
     * @throws AwsException.NotFound if absent
     */
    Resource get(ResourceType type, String id);

    Optional<Resource> find(ResourceType type, String id);

    /** Resource with the given id whatever its type. */
    Optional<Resource> lookup(String id);

    /** All resources of a type in insertion order. */
    List<Resource> list(ResourceType type);

    /**
     * Apply a change atomically.
     *
     * @throws AwsException.NotFound if the resource, or a newly referenced resource, is absent
     */
    Resource update(ResourceType type, String id, Consumer<ResourceEditor> mutator);

    /**
     * Remove a resource after checking that no live resource outside the type's cascade set
     * references it. Referencing resources in the cascade set are removed too.
     *
     * @throws AwsException.DependencyViolation if a live reference blocks the delete
     * @throws AwsException.NotFound if absent
     */
    void delete(ResourceType type, String id);

    /**
     * Merge tags into the resource's tag set; existing keys are overwritten.
     *
     * @throws AwsException.NotFound if no resource has this id
     */
    Resource tagResource(String id, Map<String, String> tags);

    /**
     * Remove tag keys from the resource's tag set. Absent keys are ignored.
     *
     * @throws AwsException.NotFound if no resource has this id
     */
    Resource untagResource(String id, Collection<String> keys);

    /** Ids of live resources referencing the given id. */
    Set<String> referencesTo(String id);

    ResourceTypeRegistry types();
}

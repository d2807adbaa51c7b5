package io.veraaws.server.spi;

/**
 * Strategy for allocating resource ids of the form {@code <prefix>-<hex suffix>}.
 *
 * <p>Implementations need not guarantee uniqueness; the store checks for collisions and asks
 * again a bounded number of times.
 */
@FunctionalInterface
public interface IdGenerator {

    /**
     * Generate a candidate id for a resource of the given type.
     *
     * @param type the resource type (its prefix and {@link IdFormat} determine the shape)
     * @return a candidate id
     */
    String next(ResourceType type);
}

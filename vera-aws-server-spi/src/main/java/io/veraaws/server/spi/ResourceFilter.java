package io.veraaws.server.spi;

import java.util.List;

/**
 * Provider attribute-filtering semantics used by every describe call.
 *
 * <p>A resource matches when it matches every filter, and matches a filter when any of the
 * filter's values matches the resolved attribute.
 */
public interface ResourceFilter {

    boolean evaluate(Resource resource, List<FilterSpec> filters);

    /** Matching resources, in input order. */
    List<Resource> evaluateAll(List<Resource> resources, List<FilterSpec> filters);
}

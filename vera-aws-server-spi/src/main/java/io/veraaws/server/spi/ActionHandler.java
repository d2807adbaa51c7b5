package io.veraaws.server.spi;

import io.veraaws.core.ValueTree;

import java.util.Set;

/**
 * Handler for one resource type (or one group of read-only actions) of a service.
 *
 * <p>Handlers must reach state only through {@link ResourceStore} and filter only through
 * {@link ResourceFilter}. They may throw {@link io.veraaws.core.AwsException} or return an
 * {@link ActionResult} of shape {@code ERROR}; both end up in the provider error envelope.
 */
public interface ActionHandler {

    /** Name of the service whose actions this handler serves, e.g. {@code ec2}. */
    String service();

    /** Action names served, e.g. {@code CreateVpc}. */
    Set<String> actions();

    ActionResult handle(String action, ValueTree.Mapping params, RequestContext context);
}

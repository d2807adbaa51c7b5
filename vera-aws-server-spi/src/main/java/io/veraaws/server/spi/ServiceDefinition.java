package io.veraaws.server.spi;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * An emulated service: its name, protocol, XML namespace, and the full set of actions it
 * declares. The action registry refuses to start if a declared action has no handler.
 */
public record ServiceDefinition(String name, ServiceProtocol protocol, String xmlNamespace, String targetPrefix, Set<String> actions) {
    public ServiceDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(protocol, "protocol");
        actions = Collections.unmodifiableSet(new LinkedHashSet<>(actions));
    }

    public boolean declares(String action) {
        return actions.contains(action);
    }
}

package io.veraaws.server.core;

import io.veraaws.server.spi.ActionHandler;
import io.veraaws.server.spi.ServiceDefinition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Explicit {@code (service, action) -> handler} table, built once at startup.
 *
 * <p>{@link Builder#build()} fails fast when a declared action has no handler, when a handler
 * serves an action its service does not declare, or when two handlers claim the same action.
 */
public final class ActionRegistry {

    private final Map<String, ServiceDefinition> services;
    private final Map<String, ServiceDefinition> byTargetPrefix;
    private final Map<String, Map<String, ActionHandler>> handlers;

    private ActionRegistry(Map<String, ServiceDefinition> services, Map<String, Map<String, ActionHandler>> handlers) {
        this.services = Collections.unmodifiableMap(new LinkedHashMap<>(services));
        Map<String, ServiceDefinition> targets = new HashMap<>();
        for (ServiceDefinition s : services.values()) {
            if (s.targetPrefix() != null) targets.put(s.targetPrefix(), s);
        }
        this.byTargetPrefix = Map.copyOf(targets);
        Map<String, Map<String, ActionHandler>> copy = new HashMap<>();
        handlers.forEach((svc, byAction) -> copy.put(svc, Map.copyOf(byAction)));
        this.handlers = Map.copyOf(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<ServiceDefinition> service(String name) {
        return Optional.ofNullable(services.get(name));
    }

    public Optional<ServiceDefinition> serviceForTarget(String targetPrefix) {
        return Optional.ofNullable(byTargetPrefix.get(targetPrefix));
    }

    public Collection<ServiceDefinition> services() {
        return services.values();
    }

    public Optional<ActionHandler> resolve(String service, String action) {
        Map<String, ActionHandler> byAction = handlers.get(service);
        if (byAction == null || action == null) return Optional.empty();
        return Optional.ofNullable(byAction.get(action));
    }

    public int actionCount() {
        int n = 0;
        for (Map<String, ActionHandler> byAction : handlers.values()) n += byAction.size();
        return n;
    }

    /**
     * Builder for {@link ActionRegistry}.
     */
    public static final class Builder {
        private final Map<String, ServiceDefinition> services = new LinkedHashMap<>();
        private final List<ActionHandler> handlers = new ArrayList<>();

        private Builder() {}

        public Builder service(ServiceDefinition service) {
            Objects.requireNonNull(service, "service");
            if (services.putIfAbsent(service.name(), service) != null) {
                throw new IllegalArgumentException("duplicate service: " + service.name());
            }
            return this;
        }

        public Builder handler(ActionHandler handler) {
            handlers.add(Objects.requireNonNull(handler, "handler"));
            return this;
        }

        public Builder handlers(Iterable<? extends ActionHandler> handlers) {
            for (ActionHandler h : handlers) handler(h);
            return this;
        }

        public ActionRegistry build() {
            Map<String, Map<String, ActionHandler>> table = new HashMap<>();
            for (ActionHandler h : handlers) {
                ServiceDefinition svc = services.get(h.service());
                if (svc == null) {
                    throw new IllegalStateException(h.getClass().getSimpleName() + " serves unregistered service " + h.service());
                }
                Map<String, ActionHandler> byAction = table.computeIfAbsent(svc.name(), k -> new HashMap<>());
                for (String action : h.actions()) {
                    if (!svc.declares(action)) {
                        throw new IllegalStateException(h.getClass().getSimpleName() + " serves undeclared action " + svc.name() + ":" + action);
                    }
                    ActionHandler previous = byAction.putIfAbsent(action, h);
                    if (previous != null) {
                        throw new IllegalStateException("action " + svc.name() + ":" + action + " claimed by both "
                                + previous.getClass().getSimpleName() + " and " + h.getClass().getSimpleName());
                    }
                }
            }

            List<String> missing = new ArrayList<>();
            for (ServiceDefinition svc : services.values()) {
                Map<String, ActionHandler> byAction = table.getOrDefault(svc.name(), Map.of());
                for (String action : svc.actions()) {
                    if (!byAction.containsKey(action)) missing.add(svc.name() + ":" + action);
                }
            }
            if (!missing.isEmpty()) {
                throw new IllegalStateException("declared actions without a handler: " + missing);
            }
            return new ActionRegistry(services, table);
        }
    }
}

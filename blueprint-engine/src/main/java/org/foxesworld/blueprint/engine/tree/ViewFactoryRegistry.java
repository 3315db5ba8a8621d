package org.foxesworld.blueprint.engine.tree;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** typeId → factory. Registrations last until {@link #clear()}. */
public final class ViewFactoryRegistry {

    private static final Logger log = LogManager.getLogger(ViewFactoryRegistry.class);

    private final Map<String, ViewFactory> factories = new LinkedHashMap<>();

    public void register(String typeId, ViewFactory factory) {
        Objects.requireNonNull(typeId, "typeId");
        Objects.requireNonNull(factory, "factory");
        if (typeId.isBlank()) throw new IllegalArgumentException("typeId is blank");

        if (factories.putIfAbsent(typeId, factory) != null) {
            throw new IllegalStateException("View type already registered: " + typeId);
        }
        log.debug("[tree] view type registered: {}", typeId);
    }

    /** @return the factory, or {@code null} if {@code typeId} is not registered */
    public ViewFactory find(String typeId) {
        return typeId == null ? null : factories.get(typeId);
    }

    public boolean contains(String typeId) {
        return find(typeId) != null;
    }

    public Set<String> typeIds() {
        return Collections.unmodifiableSet(factories.keySet());
    }

    /** Drops every registration, built-ins included. */
    public void clear() {
        factories.clear();
    }
}

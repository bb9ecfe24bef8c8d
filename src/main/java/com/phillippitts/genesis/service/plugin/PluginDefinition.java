package com.phillippitts.genesis.service.plugin;

import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Registration entry for a plugin: its identity, the shared resources it needs and how to build it.
 *
 * @param name unique plugin name
 * @param description one-line description for logs
 * @param requiredResources resources the factory may access through {@link PluginResources}
 * @param factory builds the plugin from the granted resources
 */
public record PluginDefinition(String name,
                               String description,
                               Set<SharedResource> requiredResources,
                               Function<PluginResources, GenesisPlugin> factory) {

    public PluginDefinition {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        description = description == null ? "" : description;
        requiredResources = requiredResources == null ? Set.of() : Set.copyOf(requiredResources);
        Objects.requireNonNull(factory, "factory must not be null");
    }
}

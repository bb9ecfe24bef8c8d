package com.phillippitts.genesis.service.plugin;

import com.phillippitts.genesis.exception.PluginException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Plugins in registration order.
 *
 * <p>Lookup by intent is a linear scan; the first plugin that supports the intent wins.
 * Registering a name twice replaces the earlier plugin and logs a warning. Registration happens
 * at startup; lookups may run concurrently with it and see a consistent snapshot.
 */
public class PluginRegistry {

    private static final Logger LOG = LogManager.getLogger(PluginRegistry.class);

    private final Map<SharedResource, Object> available;
    private volatile Map<String, GenesisPlugin> plugins = Map.of();

    public PluginRegistry(Map<SharedResource, Object> available) {
        this.available = available.isEmpty() ? new EnumMap<>(SharedResource.class) : new EnumMap<>(available);
    }

    /**
     * Builds the plugin with its declared resources and registers it. A factory failure is
     * logged and the plugin skipped.
     *
     * @return the registered plugin, or empty if it could not be created
     */
    public synchronized Optional<GenesisPlugin> register(PluginDefinition definition) {
        GenesisPlugin plugin;
        try {
            plugin = create(definition);
        } catch (PluginException e) {
            LOG.error("Skipping plugin '{}'", definition.name(), e);
            return Optional.empty();
        }
        Map<String, GenesisPlugin> next = new LinkedHashMap<>(plugins);
        if (next.put(definition.name(), plugin) != null) {
            LOG.warn("Plugin '{}' registered twice; replacing the earlier instance", definition.name());
        }
        plugins = next;
        LOG.info("Registered plugin '{}' ({}) with resources {}", definition.name(), definition.description(),
                definition.requiredResources());
        return Optional.of(plugin);
    }

    /**
     * First plugin, in registration order, that supports the intent.
     */
    public Optional<GenesisPlugin> findForIntent(String intent) {
        for (GenesisPlugin plugin : plugins.values()) {
            try {
                if (plugin.supportsIntent(intent)) {
                    return Optional.of(plugin);
                }
            } catch (RuntimeException e) {
                LOG.warn("Plugin '{}' failed supportsIntent({}); skipping it", plugin.name(), intent, e);
            }
        }
        return Optional.empty();
    }

    public boolean supportsIntent(String intent) {
        return findForIntent(intent).isPresent();
    }

    public Optional<GenesisPlugin> get(String name) {
        return Optional.ofNullable(plugins.get(name));
    }

    public List<GenesisPlugin> plugins() {
        return List.copyOf(plugins.values());
    }

    private GenesisPlugin create(PluginDefinition definition) {
        PluginResources resources = new PluginResources(definition.name(), definition.requiredResources(), available);
        GenesisPlugin plugin;
        try {
            plugin = definition.factory().apply(resources);
        } catch (RuntimeException e) {
            throw new PluginException("Plugin factory failed", definition.name(), e);
        }
        if (plugin == null) {
            throw new PluginException("Plugin factory returned null", definition.name());
        }
        return plugin;
    }
}

package com.phillippitts.genesis.service.plugin;

import com.phillippitts.genesis.service.connection.RobotOutput;
import com.phillippitts.genesis.service.reminder.DailyTaskScheduler;
import com.phillippitts.genesis.service.storage.KeyValueStore;
import org.springframework.core.env.Environment;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * The shared resources granted to one plugin. Asking for a resource the plugin did not declare
 * throws {@link IllegalStateException}.
 */
public final class PluginResources {

    private final String pluginName;
    private final Set<SharedResource> granted;
    private final Map<SharedResource, Object> available;

    PluginResources(String pluginName, Set<SharedResource> granted, Map<SharedResource, Object> available) {
        this.pluginName = pluginName;
        this.granted = granted.isEmpty() ? EnumSet.noneOf(SharedResource.class) : EnumSet.copyOf(granted);
        this.available = available;
    }

    public KeyValueStore storage() {
        return get(SharedResource.STORAGE, KeyValueStore.class);
    }

    public DailyTaskScheduler scheduler() {
        return get(SharedResource.SCHEDULER, DailyTaskScheduler.class);
    }

    public RobotOutput robotOutput() {
        return get(SharedResource.HARDWARE_LINK, RobotOutput.class);
    }

    public Environment settings() {
        return get(SharedResource.SETTINGS, Environment.class);
    }

    public Executor mainLoop() {
        return get(SharedResource.MAIN_LOOP, Executor.class);
    }

    public boolean isGranted(SharedResource resource) {
        return granted.contains(resource);
    }

    private <T> T get(SharedResource resource, Class<T> type) {
        if (!granted.contains(resource)) {
            throw new IllegalStateException(
                    "Plugin '" + pluginName + "' did not declare resource " + resource);
        }
        Object value = available.get(resource);
        if (value == null) {
            throw new IllegalStateException("Resource " + resource + " is not available in this runtime");
        }
        return type.cast(value);
    }
}

package com.phillippitts.genesis.config.plugin;

import com.phillippitts.genesis.config.properties.StorageProperties;
import com.phillippitts.genesis.service.connection.ConnectionManager;
import com.phillippitts.genesis.service.plugin.PluginDefinition;
import com.phillippitts.genesis.service.plugin.PluginRegistry;
import com.phillippitts.genesis.service.plugin.SharedResource;
import com.phillippitts.genesis.service.plugin.notes.MemoryNotesPlugin;
import com.phillippitts.genesis.service.reminder.DailyTaskScheduler;
import com.phillippitts.genesis.service.storage.JsonFileKeyValueStore;
import com.phillippitts.genesis.service.storage.KeyValueStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Explicit plugin registration.
 *
 * <p>Every {@link PluginDefinition} bean in the context is registered, in bean order, with
 * only the shared resources it declares. Applications add plugins by declaring more definition
 * beans.
 */
@Configuration
public class PluginConfig {

    @Bean
    public KeyValueStore keyValueStore(StorageProperties props) {
        return new JsonFileKeyValueStore(Path.of(props.getPath()));
    }

    @Bean
    @Order(0)
    public PluginDefinition memoryNotesPluginDefinition() {
        return MemoryNotesPlugin.definition();
    }

    @Bean
    public PluginRegistry pluginRegistry(KeyValueStore keyValueStore,
                                         DailyTaskScheduler dailyTaskScheduler,
                                         ConnectionManager connectionManager,
                                         Environment environment,
                                         @Qualifier("dialogueExecutor") Executor dialogueExecutor,
                                         List<PluginDefinition> definitions) {
        Map<SharedResource, Object> resources = new EnumMap<>(SharedResource.class);
        resources.put(SharedResource.STORAGE, keyValueStore);
        resources.put(SharedResource.SCHEDULER, dailyTaskScheduler);
        resources.put(SharedResource.HARDWARE_LINK, connectionManager);
        resources.put(SharedResource.SETTINGS, environment);
        resources.put(SharedResource.MAIN_LOOP, dialogueExecutor);

        PluginRegistry registry = new PluginRegistry(resources);
        definitions.forEach(registry::register);
        return registry;
    }
}

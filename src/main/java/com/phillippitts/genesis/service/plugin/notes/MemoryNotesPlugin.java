package com.phillippitts.genesis.service.plugin.notes;

import com.phillippitts.genesis.domain.IntentResult;
import com.phillippitts.genesis.service.intent.Intents;
import com.phillippitts.genesis.service.plugin.GenesisPlugin;
import com.phillippitts.genesis.service.plugin.PluginDefinition;
import com.phillippitts.genesis.service.plugin.SharedResource;
import com.phillippitts.genesis.service.storage.KeyValueStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Remembers, recalls and forgets personal facts ("remember that my favourite colour is blue").
 * Facts live in the shared key/value store under {@code fact:<lower-cased key>}.
 */
public class MemoryNotesPlugin implements GenesisPlugin {

    private static final Logger LOG = LogManager.getLogger(MemoryNotesPlugin.class);

    public static final String NAME = "memory_notes";
    static final String KEY_PREFIX = "fact:";

    private static final Set<String> INTENTS = Set.of(
            Intents.REMEMBER_FACT, Intents.RECALL_FACT, Intents.FORGET_FACT);

    private final KeyValueStore store;

    public MemoryNotesPlugin(KeyValueStore store) {
        this.store = store;
    }

    public static PluginDefinition definition() {
        return new PluginDefinition(NAME, "Remembers personal facts in the key/value store",
                Set.of(SharedResource.STORAGE), resources -> new MemoryNotesPlugin(resources.storage()));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Remembers personal facts";
    }

    @Override
    public boolean supportsIntent(String intent) {
        return INTENTS.contains(intent);
    }

    @Override
    public String execute(String rawText, IntentResult intent) {
        Optional<String> subject = intent.textEntity(Intents.ENTITY_FACT_KEY);
        return switch (intent.intent()) {
            case Intents.REMEMBER_FACT -> remember(subject, intent.textEntity(Intents.ENTITY_FACT_VALUE));
            case Intents.RECALL_FACT -> recall(subject);
            case Intents.FORGET_FACT -> forget(subject);
            default -> throw new IllegalArgumentException("Unsupported intent: " + intent.intent());
        };
    }

    private String remember(Optional<String> subject, Optional<String> value) {
        if (subject.isEmpty() || value.isEmpty()) {
            return "What would you like me to remember?";
        }
        store.put(storageKey(subject.get()), value.get());
        LOG.info("Stored fact '{}'", subject.get());
        return "Got it. I'll remember that your " + subject.get() + " is " + value.get() + ".";
    }

    private String recall(Optional<String> subject) {
        if (subject.isEmpty()) {
            return "What would you like me to recall?";
        }
        return store.get(storageKey(subject.get()))
                .map(value -> "Your " + subject.get() + " is " + value + ".")
                .orElse("I don't know your " + subject.get() + " yet.");
    }

    private String forget(Optional<String> subject) {
        if (subject.isEmpty()) {
            return "What would you like me to forget?";
        }
        if (store.remove(storageKey(subject.get()))) {
            return "Okay, I've forgotten your " + subject.get() + ".";
        }
        return "I didn't have anything stored about your " + subject.get() + ".";
    }

    static String storageKey(String subject) {
        return KEY_PREFIX + subject.trim().toLowerCase(Locale.ROOT);
    }
}

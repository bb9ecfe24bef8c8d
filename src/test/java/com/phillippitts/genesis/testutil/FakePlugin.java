package com.phillippitts.genesis.testutil;

import com.phillippitts.genesis.domain.IntentResult;
import com.phillippitts.genesis.service.plugin.GenesisPlugin;
import com.phillippitts.genesis.service.plugin.PluginDefinition;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Plugin that answers a fixed set of intents with a fixed reply and records what it was asked.
 */
public class FakePlugin implements GenesisPlugin {
    private final String name;
    private final Set<String> intents;
    private final String reply;
    private final List<IntentResult> executed = new CopyOnWriteArrayList<>();
    private volatile RuntimeException failure;

    public FakePlugin(String name, Set<String> intents, String reply) {
        this.name = name;
        this.intents = intents;
        this.reply = reply;
    }

    public static PluginDefinition definition(String name, Set<String> intents, String reply) {
        return new PluginDefinition(name, "fake", Set.of(), resources -> new FakePlugin(name, intents, reply));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return "fake";
    }

    @Override
    public boolean supportsIntent(String intent) {
        return intents.contains(intent);
    }

    @Override
    public String execute(String rawText, IntentResult intent) {
        executed.add(intent);
        RuntimeException f = failure;
        if (f != null) {
            throw f;
        }
        return reply;
    }

    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    public List<IntentResult> executed() {
        return List.copyOf(executed);
    }
}

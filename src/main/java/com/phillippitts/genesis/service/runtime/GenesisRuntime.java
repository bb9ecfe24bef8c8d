package com.phillippitts.genesis.service.runtime;

import com.phillippitts.genesis.config.properties.DialogueProperties;
import com.phillippitts.genesis.config.properties.HardwareProperties;
import com.phillippitts.genesis.exception.InitializationException;
import com.phillippitts.genesis.service.connection.ConnectionHeartbeat;
import com.phillippitts.genesis.service.connection.ConnectionManager;
import com.phillippitts.genesis.service.dialogue.DialogueOrchestrator;
import com.phillippitts.genesis.service.dialogue.TurnTracker;
import com.phillippitts.genesis.service.plugin.GenesisPlugin;
import com.phillippitts.genesis.service.plugin.PluginRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.SmartLifecycle;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Brings the robot brain up and down with the application context.
 *
 * <p><b>Start:</b> connect to the robot (failure aborts startup with
 * {@link InitializationException}), start plugin background tasks, subscribe the dialogue
 * orchestrator to sensor events, arm the heartbeat and greet.
 *
 * <p><b>Stop:</b> disarm the heartbeat, cancel plugin tasks, give in-flight turns the configured
 * grace period, then disconnect.
 */
public class GenesisRuntime implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(GenesisRuntime.class);

    static final String GREETING = "Hello. I am Genesis, the middleware brain. I am now connected to %s.";

    private final ConnectionManager connectionManager;
    private final ConnectionHeartbeat heartbeat;
    private final DialogueOrchestrator orchestrator;
    private final PluginRegistry pluginRegistry;
    private final TurnTracker turnTracker;
    private final HardwareProperties hardwareProps;
    private final DialogueProperties dialogueProps;

    private final List<CompletableFuture<Void>> pluginTasks = new ArrayList<>();
    private volatile boolean running;

    public GenesisRuntime(ConnectionManager connectionManager,
                          ConnectionHeartbeat heartbeat,
                          DialogueOrchestrator orchestrator,
                          PluginRegistry pluginRegistry,
                          TurnTracker turnTracker,
                          HardwareProperties hardwareProps,
                          DialogueProperties dialogueProps) {
        this.connectionManager = connectionManager;
        this.heartbeat = heartbeat;
        this.orchestrator = orchestrator;
        this.pluginRegistry = pluginRegistry;
        this.turnTracker = turnTracker;
        this.hardwareProps = hardwareProps;
        this.dialogueProps = dialogueProps;
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        LOG.info("Starting GENESIS runtime (robot {}:{}, simulated={})",
                hardwareProps.getHost(), hardwareProps.getPort(), hardwareProps.isSimulated());
        if (!awaitConnect()) {
            throw new InitializationException("Could not connect to robot at "
                    + hardwareProps.getHost() + ":" + hardwareProps.getPort());
        }
        startPluginTasks();
        connectionManager.subscribe(orchestrator);
        heartbeat.arm();
        running = true;
        LOG.info("GENESIS runtime started with {} plugin(s)", pluginRegistry.plugins().size());

        if (dialogueProps.isGreetingEnabled()) {
            connectionManager.speak(String.format(GREETING, connectionManager.host()))
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            LOG.warn("Failed to speak greeting", error);
                        }
                    });
        }
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        LOG.info("Stopping GENESIS runtime");
        heartbeat.disarm();
        cancelPluginTasks();
        int cancelled = turnTracker.shutdown(dialogueProps.shutdownGrace());
        if (cancelled > 0) {
            LOG.warn("{} turn(s) cancelled at shutdown", cancelled);
        }
        try {
            connectionManager.disconnect().get(hardwareProps.getPollerJoinTimeoutMs() + 1000, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while disconnecting from robot");
        } catch (ExecutionException | TimeoutException e) {
            LOG.warn("Disconnect from robot did not complete cleanly: {}", e.toString());
        }
        running = false;
        LOG.info("GENESIS runtime stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private boolean awaitConnect() {
        try {
            return Boolean.TRUE.equals(connectionManager.connect()
                    .get(hardwareProps.getConnectTimeoutMs(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InitializationException("Interrupted while connecting to robot", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new InitializationException("Connecting to robot at " + hardwareProps.getHost() + " failed", e);
        }
    }

    private void startPluginTasks() {
        for (GenesisPlugin plugin : pluginRegistry.plugins()) {
            try {
                CompletableFuture<Void> task = plugin.run();
                if (task != null && !task.isDone()) {
                    pluginTasks.add(task);
                    task.whenComplete((ignored, error) -> {
                        if (error != null && !task.isCancelled()) {
                            LOG.error("Background task of plugin '{}' failed", plugin.name(), error);
                        }
                    });
                }
            } catch (RuntimeException e) {
                LOG.error("Failed to start background task of plugin '{}'", plugin.name(), e);
            }
        }
    }

    private void cancelPluginTasks() {
        for (CompletableFuture<Void> task : pluginTasks) {
            task.cancel(true);
        }
        pluginTasks.clear();
    }

    // Visible for tests
    int activePluginTasks() {
        return (int) pluginTasks.stream().filter(t -> !t.isDone()).count();
    }
}

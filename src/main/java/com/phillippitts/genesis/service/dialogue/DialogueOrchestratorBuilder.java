package com.phillippitts.genesis.service.dialogue;

import com.phillippitts.genesis.service.connection.RobotOutput;
import com.phillippitts.genesis.service.intent.IntentResolver;
import com.phillippitts.genesis.service.metrics.DialogueMetrics;
import com.phillippitts.genesis.service.plugin.PluginRegistry;
import com.phillippitts.genesis.service.reasoning.PersonaStylist;
import com.phillippitts.genesis.service.reminder.ReminderService;
import com.phillippitts.genesis.service.time.TimeUtility;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Map;
import java.util.Objects;

/**
 * Builder for {@link DialogueOrchestrator}.
 *
 * <pre>{@code
 * DialogueOrchestrator orchestrator = DialogueOrchestratorBuilder.builder()
 *     .intentResolver(resolver)
 *     .personaRegistry(personas)
 *     .initialPersona("genesis")
 *     .pluginRegistry(plugins)
 *     .stylist(stylist)
 *     .reminderService(reminders)
 *     .timeUtility(time)
 *     .robotOutput(connectionManager)
 *     .build();
 * }</pre>
 *
 * <p>Metrics, turn tracker and the plugin registry default to fresh instances when not set.
 *
 * @since 1.0
 */
public final class DialogueOrchestratorBuilder {

    // Required dependencies
    private IntentResolver intentResolver;
    private PersonaRegistry personaRegistry;
    private PersonaStylist stylist;
    private ReminderService reminderService;
    private TimeUtility timeUtility;
    private RobotOutput robotOutput;

    // Optional dependencies
    private String initialPersona;
    private PluginRegistry pluginRegistry;
    private TurnTracker turnTracker;
    private DialogueMetrics metrics;
    private boolean stylingEnabled = true;
    private String touchResponse = "";

    private DialogueOrchestratorBuilder() {
    }

    public static DialogueOrchestratorBuilder builder() {
        return new DialogueOrchestratorBuilder();
    }

    public DialogueOrchestratorBuilder intentResolver(IntentResolver intentResolver) {
        this.intentResolver = intentResolver;
        return this;
    }

    public DialogueOrchestratorBuilder personaRegistry(PersonaRegistry personaRegistry) {
        this.personaRegistry = personaRegistry;
        return this;
    }

    /**
     * Sets the persona active at startup. Falls back to the first configured persona when unknown.
     */
    public DialogueOrchestratorBuilder initialPersona(String initialPersona) {
        this.initialPersona = initialPersona;
        return this;
    }

    public DialogueOrchestratorBuilder pluginRegistry(PluginRegistry pluginRegistry) {
        this.pluginRegistry = pluginRegistry;
        return this;
    }

    public DialogueOrchestratorBuilder stylist(PersonaStylist stylist) {
        this.stylist = stylist;
        return this;
    }

    public DialogueOrchestratorBuilder reminderService(ReminderService reminderService) {
        this.reminderService = reminderService;
        return this;
    }

    public DialogueOrchestratorBuilder timeUtility(TimeUtility timeUtility) {
        this.timeUtility = timeUtility;
        return this;
    }

    public DialogueOrchestratorBuilder robotOutput(RobotOutput robotOutput) {
        this.robotOutput = robotOutput;
        return this;
    }

    public DialogueOrchestratorBuilder turnTracker(TurnTracker turnTracker) {
        this.turnTracker = turnTracker;
        return this;
    }

    public DialogueOrchestratorBuilder metrics(DialogueMetrics metrics) {
        this.metrics = metrics;
        return this;
    }

    public DialogueOrchestratorBuilder stylingEnabled(boolean stylingEnabled) {
        this.stylingEnabled = stylingEnabled;
        return this;
    }

    /**
     * Line spoken when a head sensor is touched. Blank disables the response.
     */
    public DialogueOrchestratorBuilder touchResponse(String touchResponse) {
        this.touchResponse = touchResponse;
        return this;
    }

    /**
     * Builds the orchestrator.
     *
     * @throws NullPointerException if a required dependency is missing
     */
    public DialogueOrchestrator build() {
        Objects.requireNonNull(intentResolver, "intentResolver is required");
        Objects.requireNonNull(personaRegistry, "personaRegistry is required");
        Objects.requireNonNull(stylist, "stylist is required");
        Objects.requireNonNull(reminderService, "reminderService is required");
        Objects.requireNonNull(timeUtility, "timeUtility is required");
        Objects.requireNonNull(robotOutput, "robotOutput is required");

        return new DialogueOrchestrator(
                intentResolver,
                personaRegistry,
                new ConversationState(personaRegistry.initial(initialPersona)),
                pluginRegistry != null ? pluginRegistry : new PluginRegistry(Map.of()),
                stylist,
                reminderService,
                timeUtility,
                robotOutput,
                turnTracker != null ? turnTracker : new TurnTracker(),
                metrics != null ? metrics : new DialogueMetrics(new SimpleMeterRegistry()),
                stylingEnabled,
                touchResponse
        );
    }
}

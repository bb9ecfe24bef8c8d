package com.phillippitts.genesis.service.dialogue;

import com.phillippitts.genesis.domain.IntentResult;
import com.phillippitts.genesis.domain.Persona;
import com.phillippitts.genesis.domain.SensorEvent;
import com.phillippitts.genesis.service.connection.RobotOutput;
import com.phillippitts.genesis.service.hardware.SensorEventKeys;
import com.phillippitts.genesis.service.intent.IntentResolver;
import com.phillippitts.genesis.service.intent.Intents;
import com.phillippitts.genesis.service.metrics.DialogueMetrics;
import com.phillippitts.genesis.service.plugin.GenesisPlugin;
import com.phillippitts.genesis.service.plugin.PluginRegistry;
import com.phillippitts.genesis.service.reasoning.PersonaStylist;
import com.phillippitts.genesis.service.reminder.ReminderService;
import com.phillippitts.genesis.service.sensor.SensorEventCallback;
import com.phillippitts.genesis.service.time.TimeUtility;
import com.phillippitts.genesis.util.LogSanitizer;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Owns the conversation: persona and tone state, intent dispatch, plugin routing and styling.
 *
 * <p><b>Sensor intake:</b> {@link #handleSensorEvent} acts on recognized words only (plus a
 * spoken response to head touches). Each non-blank utterance starts a detached turn through the
 * bound {@link SpeechProcessor}; the turn is tracked for shutdown and its errors are logged here.
 *
 * <p><b>Dispatch:</b> built-in handlers first, then the first plugin that supports the intent,
 * otherwise a "no tool" apology. Handler and plugin exceptions become an apology naming the
 * intent and never escape.
 *
 * <p><b>Styling:</b> when enabled, non-blank replies are restyled in the active persona's voice.
 * Any styling failure yields the unstyled reply.
 *
 * <p>The speech processor depends on this orchestrator for turns and state, so it is bound after
 * construction with {@link #bindSpeechProcessor}.
 *
 * @since 1.0
 */
public class DialogueOrchestrator implements SensorEventCallback, ConversationView {

    private static final Logger LOG = LogManager.getLogger(DialogueOrchestrator.class);
    static final String TURN_ID = "turnId";

    private final IntentResolver intentResolver;
    private final PersonaRegistry personaRegistry;
    private final ConversationState conversationState;
    private final PluginRegistry pluginRegistry;
    private final PersonaStylist stylist;
    private final ReminderService reminderService;
    private final TimeUtility timeUtility;
    private final RobotOutput robotOutput;
    private final TurnTracker turnTracker;
    private final DialogueMetrics metrics;
    private final boolean stylingEnabled;
    private final String touchResponse;
    private final Map<String, IntentHandler> handlers;

    private volatile SpeechProcessor speechProcessor;

    DialogueOrchestrator(IntentResolver intentResolver,
                         PersonaRegistry personaRegistry,
                         ConversationState conversationState,
                         PluginRegistry pluginRegistry,
                         PersonaStylist stylist,
                         ReminderService reminderService,
                         TimeUtility timeUtility,
                         RobotOutput robotOutput,
                         TurnTracker turnTracker,
                         DialogueMetrics metrics,
                         boolean stylingEnabled,
                         String touchResponse) {
        this.intentResolver = intentResolver;
        this.personaRegistry = personaRegistry;
        this.conversationState = conversationState;
        this.pluginRegistry = pluginRegistry;
        this.stylist = stylist;
        this.reminderService = reminderService;
        this.timeUtility = timeUtility;
        this.robotOutput = robotOutput;
        this.turnTracker = turnTracker;
        this.metrics = metrics;
        this.stylingEnabled = stylingEnabled;
        this.touchResponse = touchResponse == null ? "" : touchResponse;
        this.handlers = Map.of(
                Intents.TELL_TIME, intent -> timeUtility.tellTime(),
                Intents.TELL_DATE, intent -> timeUtility.tellDate(),
                Intents.SET_REMINDER, this::handleSetReminder,
                Intents.CANCEL_REMINDER, this::handleCancelReminder,
                Intents.CHANGE_PERSONALITY, this::handleChangePersonality,
                Intents.CHANGE_TONE, this::handleChangeTone
        );
        LOG.info("DialogueOrchestrator initialized. Initial persona: {}, tone: {}, styling: {}",
                conversationState.snapshot().persona().name(), conversationState.snapshot().tone(), stylingEnabled);
    }

    /**
     * Binds the processor that runs full turns. Must be called before sensor events arrive.
     */
    public void bindSpeechProcessor(SpeechProcessor processor) {
        this.speechProcessor = processor;
    }

    @Override
    public void onSensorEvent(SensorEvent event) {
        handleSensorEvent(event);
    }

    /**
     * Entry point for sensor events handed over by the poller. Returns without waiting for the turn.
     */
    public void handleSensorEvent(SensorEvent event) {
        String name = event.eventName();
        LOG.debug("Sensor event received: {} ({})", name, LogSanitizer.preview(event.value()));

        if (SensorEventKeys.WORD_RECOGNIZED.equals(name)) {
            String text = utteranceText(event.value());
            if (text.isBlank()) {
                LOG.debug("Ignoring blank recognition result");
                return;
            }
            if (turnTracker.isClosing()) {
                LOG.info("Shutting down; ignoring utterance");
                return;
            }
            submitUtterance(text).whenComplete((reply, error) -> {
                if (error != null && !(unwrap(error) instanceof CancellationException)) {
                    LOG.error("Turn failed", unwrap(error));
                }
            });
        } else if (SensorEventKeys.isHeadTouch(name)) {
            respondToTouch(name);
        }
    }

    /**
     * Starts a full turn for an utterance and tracks it until it finishes.
     *
     * @return future with the spoken reply
     * @throws IllegalStateException if no speech processor has been bound
     */
    public CompletableFuture<String> submitUtterance(String text) {
        SpeechProcessor processor = speechProcessor;
        if (processor == null) {
            throw new IllegalStateException("No speech processor bound to the dialogue orchestrator");
        }
        if (turnTracker.isClosing()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Dialogue is shutting down"));
        }
        String turnId = UUID.randomUUID().toString().substring(0, 8);
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put(TURN_ID, turnId)) {
            LOG.info("Turn started: '{}'", LogSanitizer.truncate(text, LogSanitizer.PREVIEW_CHARS));
            CompletableFuture<String> turn;
            try {
                turn = processor.processUserSpeech(text);
            } catch (RuntimeException e) {
                turn = CompletableFuture.failedFuture(e);
            }
            turnTracker.track(turn);
            return turn;
        }
    }

    /**
     * Resolves the intent of {@code text} and produces the reply without speaking it.
     */
    public CompletableFuture<String> processTurn(String text) {
        return processTurn(resolveIntent(text));
    }

    /**
     * Produces the reply for an already resolved intent without speaking it.
     */
    public CompletableFuture<String> processTurn(IntentResult intent) {
        String baseReply = dispatch(intent);
        return stylize(baseReply, intent.originalText());
    }

    /**
     * Classifies an utterance. Resolver failures classify as {@link Intents#UNKNOWN}.
     */
    public IntentResult resolveIntent(String text) {
        try {
            return intentResolver.resolve(text);
        } catch (RuntimeException e) {
            LOG.error("Intent resolution failed; treating utterance as unknown", e);
            return IntentResult.of(Intents.UNKNOWN, text);
        }
    }

    /** {@code true} if a built-in handler owns the intent. */
    public boolean ownsIntent(String intent) {
        return handlers.containsKey(intent);
    }

    /** {@code true} if a registered plugin declares support for the intent. */
    public boolean hasPluginFor(String intent) {
        return pluginRegistry.supportsIntent(intent);
    }

    public List<String> availablePersonas() {
        return personaRegistry.availableNames();
    }

    @Override
    public Persona currentPersona() {
        return conversationState.snapshot().persona();
    }

    @Override
    public String currentTone() {
        return conversationState.snapshot().tone();
    }

    @Override
    public ConversationState.Snapshot conversationState() {
        return conversationState.snapshot();
    }

    String dispatch(IntentResult intent) {
        String name = intent.intent();
        IntentHandler handler = handlers.get(name);
        if (handler != null) {
            return runIsolated(name, () -> handler.handle(intent));
        }
        Optional<GenesisPlugin> plugin = pluginRegistry.findForIntent(name);
        if (plugin.isPresent()) {
            LOG.info("Routing intent '{}' to plugin '{}'", name, plugin.get().name());
            return runIsolated(name, () -> plugin.get().execute(intent.originalText(), intent));
        }
        LOG.info("No handler or plugin for intent '{}'", name);
        return ResponseFormatter.missingTool(name);
    }

    private String runIsolated(String intent, Supplier<String> action) {
        try {
            String reply = action.get();
            return reply == null ? "" : reply;
        } catch (RuntimeException e) {
            LOG.error("Error executing handler for intent '{}'", intent, e);
            metrics.recordHandlerFailure(intent);
            return ResponseFormatter.handlerFailure(intent);
        }
    }

    private CompletableFuture<String> stylize(String baseReply, String originalQuery) {
        ConversationState.Snapshot state = conversationState.snapshot();
        if (!stylingEnabled || baseReply == null || baseReply.isBlank()) {
            return CompletableFuture.completedFuture(baseReply);
        }
        String instruction = state.persona().systemPrompt() + "\nRespond in a " + state.tone()
                + " tone. Keep the response suitable for robotic speech.";
        return stylist.stylize(instruction, baseReply, originalQuery);
    }

    private void respondToTouch(String sensor) {
        if (touchResponse.isBlank()) {
            return;
        }
        LOG.info("Head touched ({})", sensor);
        robotOutput.speak(touchResponse).whenComplete((ignored, error) -> {
            if (error != null) {
                LOG.warn("Failed to speak touch response", unwrap(error));
            }
        });
    }

    private String handleChangePersonality(IntentResult intent) {
        Optional<String> requested = intent.textEntity(Intents.ENTITY_PERSONA_NAME);
        Optional<Persona> persona = requested.flatMap(personaRegistry::find);
        if (persona.isPresent()) {
            conversationState.switchPersona(persona.get());
            LOG.info("Personality changed to: {}", persona.get().name());
            return "Okay, I've switched my personality to " + persona.get().name() + ".";
        }
        return "Sorry, I don't have a personality named '" + requested.orElse("") + "'. Available: "
                + String.join(", ", personaRegistry.availableNames()) + ".";
    }

    private String handleChangeTone(IntentResult intent) {
        Optional<String> tone = intent.textEntity(Intents.ENTITY_TONE_NAME);
        if (tone.isEmpty()) {
            return "What tone would you like me to use?";
        }
        conversationState.changeTone(tone.get());
        LOG.info("Tone changed to: {}", tone.get());
        return "Alright, I'll try to adopt a " + tone.get() + " tone.";
    }

    private String handleSetReminder(IntentResult intent) {
        Optional<String> note = intent.textEntity(Intents.ENTITY_NOTE);
        Optional<String> time = intent.textEntity(Intents.ENTITY_TIME);
        if (note.isEmpty() || time.isEmpty()) {
            return "To set a reminder, I need the reminder text and a specific time.";
        }
        return reminderService.setupReminder(note.get(), time.get());
    }

    private String handleCancelReminder(IntentResult intent) {
        Optional<String> name = intent.textEntity(Intents.ENTITY_REMINDER_NAME);
        if (name.isPresent()) {
            return reminderService.cancelReminderByName(name.get());
        }
        Optional<String> note = intent.textEntity(Intents.ENTITY_NOTE);
        Optional<String> time = intent.textEntity(Intents.ENTITY_TIME);
        if (note.isEmpty() || time.isEmpty()) {
            return "To cancel a reminder, I need the reminder text and its time.";
        }
        return reminderService.cancelReminder(note.get(), time.get());
    }

    static String utteranceText(Object value) {
        Object raw = value;
        if (value instanceof List<?> list) {
            raw = list.isEmpty() ? "" : list.get(0);
        } else if (value instanceof Object[] array) {
            raw = array.length == 0 ? "" : array[0];
        }
        return raw == null ? "" : String.valueOf(raw).trim();
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}

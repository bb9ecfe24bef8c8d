package com.phillippitts.genesis.service.dialogue;

import com.phillippitts.genesis.domain.IntentResult;
import com.phillippitts.genesis.domain.Persona;
import com.phillippitts.genesis.domain.SensorEvent;
import com.phillippitts.genesis.service.hardware.SensorEventKeys;
import com.phillippitts.genesis.service.intent.Intents;
import com.phillippitts.genesis.service.intent.KeywordIntentResolver;
import com.phillippitts.genesis.service.metrics.DialogueMetrics;
import com.phillippitts.genesis.service.plugin.PluginRegistry;
import com.phillippitts.genesis.service.reasoning.PersonaStylist;
import com.phillippitts.genesis.service.reasoning.ReasoningReplies;
import com.phillippitts.genesis.service.reminder.ReminderService;
import com.phillippitts.genesis.service.time.TimeUtility;
import com.phillippitts.genesis.testutil.FakeDailyTaskScheduler;
import com.phillippitts.genesis.testutil.FakePlugin;
import com.phillippitts.genesis.testutil.FakeReasoningGateway;
import com.phillippitts.genesis.testutil.FakeRobotOutput;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DialogueOrchestratorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-04T15:07:00Z"), ZoneOffset.UTC);
    private static final Persona GENESIS = new Persona("Genesis", "friendly", "You are {name}.", "en-US");
    private static final Persona PROFESSOR = new Persona("Professor", "formal", "You are {name}.", "en-US");

    private FakeRobotOutput output;
    private FakeDailyTaskScheduler scheduler;
    private FakeReasoningGateway gateway;
    private PluginRegistry plugins;
    private TurnTracker turnTracker;
    private SimpleMeterRegistry registry;
    private List<String> processed;

    @BeforeEach
    void setUp() {
        output = new FakeRobotOutput();
        scheduler = new FakeDailyTaskScheduler();
        gateway = new FakeReasoningGateway((instruction, query) -> "styled");
        plugins = new PluginRegistry(Map.of());
        turnTracker = new TurnTracker();
        registry = new SimpleMeterRegistry();
        processed = new CopyOnWriteArrayList<>();
    }

    private DialogueOrchestrator orchestrator(boolean styling) {
        DialogueOrchestrator orchestrator = DialogueOrchestratorBuilder.builder()
                .intentResolver(new KeywordIntentResolver())
                .personaRegistry(new PersonaRegistry(List.of(GENESIS, PROFESSOR), "en-US"))
                .initialPersona("genesis")
                .pluginRegistry(plugins)
                .stylist(new PersonaStylist(gateway))
                .reminderService(new ReminderService(scheduler, output))
                .timeUtility(new TimeUtility(CLOCK))
                .robotOutput(output)
                .turnTracker(turnTracker)
                .metrics(new DialogueMetrics(registry))
                .stylingEnabled(styling)
                .touchResponse("Please don't touch my head.")
                .build();
        orchestrator.bindSpeechProcessor(text -> {
            processed.add(text);
            return CompletableFuture.completedFuture("reply to " + text);
        });
        return orchestrator;
    }

    private static String reply(DialogueOrchestrator orchestrator, String text) {
        return orchestrator.processTurn(text).join();
    }

    @Test
    void shouldStartTurnForRecognizedWords() {
        // Arrange
        DialogueOrchestrator orchestrator = orchestrator(false);

        // Act
        orchestrator.onSensorEvent(SensorEvent.of(SensorEventKeys.WORD_RECOGNIZED, List.of("  hello robot ", 0.9)));

        // Assert
        assertThat(processed).containsExactly("hello robot");
    }

    @Test
    void shouldIgnoreBlankRecognitionAndOtherEvents() {
        DialogueOrchestrator orchestrator = orchestrator(false);

        orchestrator.onSensorEvent(SensorEvent.of(SensorEventKeys.WORD_RECOGNIZED, List.of("   ", 0.2)));
        orchestrator.onSensorEvent(SensorEvent.of(SensorEventKeys.TEXT_DONE, 1));
        orchestrator.onSensorEvent(SensorEvent.of(SensorEventKeys.TOUCH_CHANGED, List.of(1)));

        assertThat(processed).isEmpty();
        assertThat(output.spoken()).isEmpty();
    }

    @Test
    void shouldSpeakTouchResponseForHeadTouch() {
        DialogueOrchestrator orchestrator = orchestrator(false);

        orchestrator.onSensorEvent(SensorEvent.of(SensorEventKeys.FRONT_HEAD_TOUCHED, 1));

        assertThat(output.spoken()).containsExactly("Please don't touch my head.");
        assertThat(processed).isEmpty();
    }

    @Test
    void shouldIgnoreUtterancesOnceShuttingDown() {
        DialogueOrchestrator orchestrator = orchestrator(false);
        turnTracker.shutdown(Duration.ZERO);

        orchestrator.onSensorEvent(SensorEvent.of(SensorEventKeys.WORD_RECOGNIZED, List.of("hello", 0.9)));

        assertThat(processed).isEmpty();
        assertThat(orchestrator.submitUtterance("hello")).isCompletedExceptionally();
    }

    @Test
    void shouldTagTurnWithTurnId() {
        // Arrange
        DialogueOrchestrator orchestrator = orchestrator(false);
        AtomicReference<String> turnId = new AtomicReference<>();
        orchestrator.bindSpeechProcessor(text -> {
            turnId.set(ThreadContext.get(DialogueOrchestrator.TURN_ID));
            return CompletableFuture.completedFuture("ok");
        });

        // Act
        String reply = orchestrator.submitUtterance("hi").join();

        // Assert
        assertThat(reply).isEqualTo("ok");
        assertThat(turnId.get()).hasSize(8);
        assertThat(ThreadContext.get(DialogueOrchestrator.TURN_ID)).isNull();
    }

    @Test
    void shouldTrackTurnUntilComplete() {
        // Arrange
        DialogueOrchestrator orchestrator = orchestrator(false);
        CompletableFuture<String> pending = new CompletableFuture<>();
        orchestrator.bindSpeechProcessor(text -> pending);

        // Act
        orchestrator.submitUtterance("slow question");
        int inFlight = turnTracker.inFlightCount();
        pending.complete("answer");

        // Assert
        assertThat(inFlight).isEqualTo(1);
        assertThat(turnTracker.inFlightCount()).isZero();
    }

    @Test
    void shouldRejectUtteranceWithoutSpeechProcessor() {
        DialogueOrchestrator orchestrator = DialogueOrchestratorBuilder.builder()
                .intentResolver(new KeywordIntentResolver())
                .personaRegistry(new PersonaRegistry(List.of(GENESIS), "en-US"))
                .stylist(new PersonaStylist(gateway))
                .reminderService(new ReminderService(scheduler, output))
                .timeUtility(new TimeUtility(CLOCK))
                .robotOutput(output)
                .build();

        assertThatThrownBy(() -> orchestrator.submitUtterance("hello"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldAnswerTimeFromHandler() {
        assertThat(reply(orchestrator(false), "What time is it?")).isEqualTo("The current time is 3:07 PM.");
    }

    @Test
    void shouldSwitchPersonalityAndResetTone() {
        // Arrange
        DialogueOrchestrator orchestrator = orchestrator(false);
        reply(orchestrator, "change your tone to sarcastic");

        // Act
        String reply = reply(orchestrator, "Switch your personality to professor");

        // Assert
        assertThat(reply).isEqualTo("Okay, I've switched my personality to Professor.");
        assertThat(orchestrator.currentPersona()).isEqualTo(PROFESSOR);
        assertThat(orchestrator.currentTone()).isEqualTo("formal");
    }

    @Test
    void shouldListPersonasWhenRequestedOneIsUnknown() {
        DialogueOrchestrator orchestrator = orchestrator(false);

        String reply = reply(orchestrator, "switch your personality to pirate");

        assertThat(reply).isEqualTo("Sorry, I don't have a personality named 'pirate'. Available: Genesis, Professor.");
        assertThat(orchestrator.currentPersona()).isEqualTo(GENESIS);
    }

    @Test
    void shouldChangeToneOrAskForOne() {
        DialogueOrchestrator orchestrator = orchestrator(false);

        assertThat(reply(orchestrator, "change tone")).isEqualTo("What tone would you like me to use?");
        assertThat(reply(orchestrator, "change your tone to cheerful"))
                .isEqualTo("Alright, I'll try to adopt a cheerful tone.");
        assertThat(orchestrator.conversationState())
                .isEqualTo(new ConversationState.Snapshot(GENESIS, "cheerful"));
    }

    @Test
    void shouldScheduleAndCancelReminder() {
        // Arrange
        DialogueOrchestrator orchestrator = orchestrator(false);

        // Act
        String set = reply(orchestrator, "Remind me to water the plants at 18:30");
        String cancel = reply(orchestrator, "cancel my reminder to water the plants at 18:30");

        // Assert
        assertThat(set).isEqualTo("Task 'daily_reminder_1830_water_the_' scheduled daily at 18:30.");
        assertThat(cancel).isEqualTo("Task 'daily_reminder_1830_water_the_' has been cancelled.");
        assertThat(scheduler.taskNames()).isEmpty();
    }

    @Test
    void shouldAskForTimeWhenReminderIncomplete() {
        assertThat(reply(orchestrator(false), "remind me to call mum"))
                .isEqualTo("To set a reminder, I need the reminder text and a specific time.");
    }

    @Test
    void shouldCancelReminderByName() {
        DialogueOrchestrator orchestrator = orchestrator(false);
        reply(orchestrator, "Remind me to stretch at 7:00");

        String reply = orchestrator.processTurn(new IntentResult(Intents.CANCEL_REMINDER,
                Map.of(Intents.ENTITY_REMINDER_NAME, "daily_reminder_700_stretch"), "cancel it")).join();

        assertThat(reply).isEqualTo("Task 'daily_reminder_700_stretch' has been cancelled.");
    }

    @Test
    void shouldNeverConsultPluginsForBuiltInIntents() {
        // Arrange
        plugins.register(FakePlugin.definition("clock", Set.of(Intents.TELL_TIME), "Plugin time"));
        DialogueOrchestrator orchestrator = orchestrator(false);

        // Act
        String reply = reply(orchestrator, "what time is it");

        // Assert
        assertThat(reply).isEqualTo("The current time is 3:07 PM.");
        FakePlugin clock = (FakePlugin) plugins.get("clock").orElseThrow();
        assertThat(clock.executed()).isEmpty();
        assertThat(orchestrator.ownsIntent(Intents.TELL_TIME)).isTrue();
    }

    @Test
    void shouldReturnPluginReplyVerbatim() {
        // Arrange
        plugins.register(FakePlugin.definition("weather", Set.of("weather"), "It's sunny in Lisbon."));
        DialogueOrchestrator orchestrator = orchestrator(false);

        // Act
        String reply = orchestrator.processTurn(IntentResult.of("weather", "how's the weather")).join();

        // Assert
        assertThat(reply).isEqualTo("It's sunny in Lisbon.");
        assertThat(orchestrator.hasPluginFor("weather")).isTrue();
    }

    @Test
    void shouldApologizeWhenPluginFails() {
        // Arrange
        plugins.register(FakePlugin.definition("weather", Set.of("weather"), "unused"));
        ((FakePlugin) plugins.get("weather").orElseThrow()).failWith(new IllegalStateException("API down"));
        DialogueOrchestrator orchestrator = orchestrator(false);

        // Act
        String reply = orchestrator.processTurn(IntentResult.of("weather", "weather?")).join();

        // Assert
        assertThat(reply).isEqualTo(
                "Sorry, I encountered an issue: I had trouble processing your request concerning 'weather'.");
        assertThat(registry.get("genesis.turn.handler.failure").tag("intent", "weather").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldApologizeWhenNoToolHandlesIntent() {
        String reply = orchestrator(false).processTurn(IntentResult.of("book_flight", "book a flight")).join();

        assertThat(reply).isEqualTo("Sorry, I encountered an issue: I understood the intent 'book_flight', "
                + "but I lack the specific tool to execute it directly.");
    }

    @Test
    void shouldStyleReplyWithPersonaAndTone() {
        // Arrange
        DialogueOrchestrator orchestrator = orchestrator(true);

        // Act
        String reply = reply(orchestrator, "what time is it");

        // Assert
        assertThat(reply).isEqualTo("styled");
        FakeReasoningGateway.Call call = gateway.calls().get(0);
        assertThat(call.instruction()).isEqualTo(
                "You are Genesis.\nRespond in a friendly tone. Keep the response suitable for robotic speech.");
        assertThat(call.query()).contains("The current time is 3:07 PM.");
    }

    @Test
    void shouldSpeakUnstyledReplyWhenStylingUnavailable() {
        gateway = new FakeReasoningGateway(ReasoningReplies.DISCONNECTED);
        DialogueOrchestrator orchestrator = orchestrator(true);

        assertThat(reply(orchestrator, "what time is it")).isEqualTo("The current time is 3:07 PM.");
    }

    @Test
    void shouldTreatResolverFailureAsUnknown() {
        DialogueOrchestrator orchestrator = DialogueOrchestratorBuilder.builder()
                .intentResolver(text -> {
                    throw new IllegalStateException("model not loaded");
                })
                .personaRegistry(new PersonaRegistry(List.of(GENESIS), "en-US"))
                .stylist(new PersonaStylist(gateway))
                .reminderService(new ReminderService(scheduler, output))
                .timeUtility(new TimeUtility(CLOCK))
                .robotOutput(output)
                .build();

        IntentResult result = orchestrator.resolveIntent("hello");

        assertThat(result.intent()).isEqualTo(Intents.UNKNOWN);
        assertThat(result.originalText()).isEqualTo("hello");
    }

    @Test
    void shouldExtractUtteranceFromListOrArray() {
        assertThat(DialogueOrchestrator.utteranceText(List.of(" hi ", 0.5))).isEqualTo("hi");
        assertThat(DialogueOrchestrator.utteranceText(new Object[] {"hey"})).isEqualTo("hey");
        assertThat(DialogueOrchestrator.utteranceText(List.of())).isEmpty();
        assertThat(DialogueOrchestrator.utteranceText("plain")).isEqualTo("plain");
    }
}

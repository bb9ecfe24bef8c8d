package com.phillippitts.genesis.service.planner;

import com.phillippitts.genesis.domain.ActionPlan;
import com.phillippitts.genesis.domain.IntentResult;
import com.phillippitts.genesis.service.connection.RobotOutput;
import com.phillippitts.genesis.service.dialogue.ConversationState;
import com.phillippitts.genesis.service.dialogue.DialogueOrchestrator;
import com.phillippitts.genesis.service.dialogue.SpeechProcessor;
import com.phillippitts.genesis.service.intent.Intents;
import com.phillippitts.genesis.service.log.InteractionLog;
import com.phillippitts.genesis.service.metrics.DialogueMetrics;
import com.phillippitts.genesis.service.reasoning.ReasoningGateway;
import com.phillippitts.genesis.service.reasoning.ReasoningReplies;
import com.phillippitts.genesis.service.time.TimeUtility;
import com.phillippitts.genesis.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Turns an utterance into an {@link ActionPlan} and executes it on the robot.
 *
 * <p><b>Routing:</b>
 * <ul>
 *   <li>time and date: answered directly, neutral motion</li>
 *   <li>personality and tone changes: orchestrator turn, joyful body language</li>
 *   <li>reminders and plugin-supported intents: orchestrator turn, head nod</li>
 *   <li>everything else: reasoning gateway with the active persona, thinking body language</li>
 * </ul>
 *
 * <p><b>Execution:</b> speech and motion start together; the turn ends when both finish, or when
 * speech finishes if no motion was started. Any failure along the way is logged and answered with
 * {@link #ERROR_REPLY}; the returned future does not complete exceptionally for it.
 *
 * @since 1.0
 */
public class ActionPlanner implements SpeechProcessor {

    private static final Logger LOG = LogManager.getLogger(ActionPlanner.class);

    static final String ERROR_REPLY = "I encountered an error while processing your request.";
    static final String FALLBACK_REPLY = "I'm not sure how to respond to that.";

    static final String ROUTE_INTERNAL = "internal";
    static final String ROUTE_PLUGIN = "plugin";
    static final String ROUTE_REASONING = "reasoning";

    private final DialogueOrchestrator orchestrator;
    private final TimeUtility timeUtility;
    private final ReasoningGateway gateway;
    private final RobotOutput robotOutput;
    private final InteractionLog interactionLog;
    private final DialogueMetrics metrics;
    private final double motionSpeed;

    public ActionPlanner(DialogueOrchestrator orchestrator,
                         TimeUtility timeUtility,
                         ReasoningGateway gateway,
                         RobotOutput robotOutput,
                         InteractionLog interactionLog,
                         DialogueMetrics metrics,
                         double motionSpeed) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.timeUtility = Objects.requireNonNull(timeUtility, "timeUtility must not be null");
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
        this.robotOutput = Objects.requireNonNull(robotOutput, "robotOutput must not be null");
        this.interactionLog = Objects.requireNonNull(interactionLog, "interactionLog must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.motionSpeed = motionSpeed;
    }

    @Override
    public CompletableFuture<String> processUserSpeech(String text) {
        long start = System.nanoTime();
        IntentResult intent = orchestrator.resolveIntent(text);
        String route = routeFor(intent.intent());
        LOG.info("Planning turn: intent={}, route={}, entities={}", intent.intent(), route,
                intent.entities().keySet());

        CompletableFuture<ActionPlan> plan;
        try {
            plan = plan(intent, route);
        } catch (RuntimeException e) {
            plan = CompletableFuture.failedFuture(e);
        }
        return plan
                .thenCompose(p -> execute(text, p))
                .handle((reply, error) -> {
                    if (error != null) {
                        LOG.error("Error executing action plan for '{}'",
                                LogSanitizer.truncate(text, LogSanitizer.PREVIEW_CHARS), unwrap(error));
                        metrics.recordTurn(route, "error", System.nanoTime() - start);
                        return ERROR_REPLY;
                    }
                    metrics.recordTurn(route, "success", System.nanoTime() - start);
                    return reply;
                });
    }

    String routeFor(String intent) {
        if (Intents.TELL_TIME.equals(intent) || Intents.TELL_DATE.equals(intent)
                || Intents.CHANGE_PERSONALITY.equals(intent) || Intents.CHANGE_TONE.equals(intent)
                || Intents.SET_REMINDER.equals(intent) || Intents.CANCEL_REMINDER.equals(intent)) {
            return ROUTE_INTERNAL;
        }
        if (!orchestrator.ownsIntent(intent) && orchestrator.hasPluginFor(intent)) {
            return ROUTE_PLUGIN;
        }
        return ROUTE_REASONING;
    }

    private CompletableFuture<ActionPlan> plan(IntentResult intent, String route) {
        return switch (intent.intent()) {
            case Intents.TELL_TIME -> CompletableFuture.completedFuture(
                    new ActionPlan(timeUtility.tellTime(), MotionCommands.NEUTRAL));
            case Intents.TELL_DATE -> CompletableFuture.completedFuture(
                    new ActionPlan(timeUtility.tellDate(), MotionCommands.NEUTRAL));
            case Intents.CHANGE_PERSONALITY, Intents.CHANGE_TONE -> orchestratorTurn(intent, MotionCommands.JOY);
            case Intents.SET_REMINDER, Intents.CANCEL_REMINDER -> orchestratorTurn(intent, MotionCommands.NOD);
            default -> ROUTE_PLUGIN.equals(route)
                    ? orchestratorTurn(intent, MotionCommands.NOD)
                    : reasoningTurn(intent);
        };
    }

    private CompletableFuture<ActionPlan> orchestratorTurn(IntentResult intent, String motion) {
        return orchestrator.processTurn(intent).thenApply(reply -> new ActionPlan(reply, motion));
    }

    private CompletableFuture<ActionPlan> reasoningTurn(IntentResult intent) {
        ConversationState.Snapshot state = orchestrator.conversationState();
        String instruction = state.persona().systemPrompt()
                + "\nYou are speaking through a physical robot named Pepper. Keep responses concise "
                + "and conversational. Respond in a " + state.tone() + " tone.";
        return gateway.getResponse(instruction, intent.originalText()).thenApply(reply -> {
            if (ReasoningReplies.isSentinel(reply)) {
                LOG.warn("Reasoning backend unavailable; speaking fallback reply: {}", reply);
            }
            return new ActionPlan(reply, MotionCommands.THINK);
        });
    }

    private CompletableFuture<String> execute(String userText, ActionPlan plan) {
        if (plan == null || !plan.hasSpeech()) {
            LOG.info("No speech planned; using fallback reply");
            return robotOutput.speak(FALLBACK_REPLY).thenApply(ignored -> FALLBACK_REPLY);
        }
        CompletableFuture<Void> speech = robotOutput.speak(plan.speech());
        CompletableFuture<Void> done = speech;
        if (MotionCommands.isActive(plan.motion())) {
            String posture = MotionCommands.postureFor(plan.motion());
            LOG.debug("Motion {} resolved to posture {}", plan.motion(), posture);
            done = CompletableFuture.allOf(speech, robotOutput.moveToPosture(posture, motionSpeed));
        }
        return done.thenApply(ignored -> {
            interactionLog.append(userText, plan.speech());
            return plan.speech();
        });
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}

package com.phillippitts.genesis.config.dialogue;

import com.phillippitts.genesis.config.properties.DialogueProperties;
import com.phillippitts.genesis.config.properties.HardwareProperties;
import com.phillippitts.genesis.config.properties.PersonaProperties;
import com.phillippitts.genesis.config.properties.ReasoningProperties;
import com.phillippitts.genesis.service.connection.ConnectionHeartbeat;
import com.phillippitts.genesis.service.connection.ConnectionManager;
import com.phillippitts.genesis.service.dialogue.DialogueOrchestrator;
import com.phillippitts.genesis.service.dialogue.DialogueOrchestratorBuilder;
import com.phillippitts.genesis.service.dialogue.PersonaRegistry;
import com.phillippitts.genesis.service.dialogue.TurnTracker;
import com.phillippitts.genesis.service.intent.IntentResolver;
import com.phillippitts.genesis.service.intent.KeywordIntentResolver;
import com.phillippitts.genesis.service.log.FileInteractionLog;
import com.phillippitts.genesis.service.log.InteractionLog;
import com.phillippitts.genesis.service.metrics.DialogueMetrics;
import com.phillippitts.genesis.service.planner.ActionPlanner;
import com.phillippitts.genesis.service.plugin.PluginRegistry;
import com.phillippitts.genesis.service.reasoning.GeminiReasoningGateway;
import com.phillippitts.genesis.service.reasoning.GeminiRestClient;
import com.phillippitts.genesis.service.reasoning.GenerativeModelClient;
import com.phillippitts.genesis.service.reasoning.PersonaStylist;
import com.phillippitts.genesis.service.reasoning.ReasoningGateway;
import com.phillippitts.genesis.service.reminder.CronDailyTaskScheduler;
import com.phillippitts.genesis.service.reminder.DailyTaskScheduler;
import com.phillippitts.genesis.service.reminder.ReminderService;
import com.phillippitts.genesis.service.runtime.GenesisRuntime;
import com.phillippitts.genesis.service.time.TimeUtility;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.client.RestClient;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the dialogue pipeline: intent resolution, personas, reasoning, reminders, the
 * orchestrator, the action planner and the runtime lifecycle.
 *
 * <p>The planner depends on the orchestrator, and the orchestrator hands turns to the planner;
 * the planner bean binds itself to the orchestrator when it is created.
 */
@Configuration
public class DialogueConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean
    public IntentResolver intentResolver() {
        return new KeywordIntentResolver();
    }

    @Bean
    public PersonaRegistry personaRegistry(PersonaProperties personaProperties, DialogueProperties dialogueProperties) {
        return PersonaRegistry.fromProperties(personaProperties, dialogueProperties.getLanguage());
    }

    /**
     * Gateway to the remote language model. Without an API key it answers every call with the
     * disconnected reply.
     */
    @Bean
    public ReasoningGateway reasoningGateway(RestClient.Builder restClientBuilder,
                                             ReasoningProperties props,
                                             @Qualifier("reasoningExecutor") Executor reasoningExecutor,
                                             DialogueMetrics metrics) {
        GenerativeModelClient client = null;
        if (props.hasApiKey()) {
            SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout(props.getConnectTimeoutMs());
            requestFactory.setReadTimeout(props.getReadTimeoutMs());
            client = new GeminiRestClient(restClientBuilder.requestFactory(requestFactory), props);
        }
        return new GeminiReasoningGateway(client, reasoningExecutor, metrics);
    }

    @Bean
    public PersonaStylist personaStylist(ReasoningGateway reasoningGateway) {
        return new PersonaStylist(reasoningGateway);
    }

    @Bean
    public TimeUtility timeUtility(Clock clock) {
        return new TimeUtility(clock);
    }

    @Bean
    public InteractionLog interactionLog(DialogueProperties props, Clock clock) {
        return new FileInteractionLog(Path.of(props.getInteractionLogPath()), clock);
    }

    @Bean(destroyMethod = "cancelAll")
    public CronDailyTaskScheduler dailyTaskScheduler(TaskScheduler taskScheduler, Clock clock) {
        return new CronDailyTaskScheduler(taskScheduler, clock.getZone());
    }

    @Bean
    public ReminderService reminderService(DailyTaskScheduler dailyTaskScheduler, ConnectionManager connectionManager) {
        return new ReminderService(dailyTaskScheduler, connectionManager);
    }

    @Bean
    public TurnTracker turnTracker() {
        return new TurnTracker();
    }

    @Bean
    public DialogueOrchestrator dialogueOrchestrator(IntentResolver intentResolver,
                                                     PersonaRegistry personaRegistry,
                                                     PluginRegistry pluginRegistry,
                                                     PersonaStylist personaStylist,
                                                     ReminderService reminderService,
                                                     TimeUtility timeUtility,
                                                     ConnectionManager connectionManager,
                                                     TurnTracker turnTracker,
                                                     DialogueMetrics metrics,
                                                     DialogueProperties props) {
        return DialogueOrchestratorBuilder.builder()
                .intentResolver(intentResolver)
                .personaRegistry(personaRegistry)
                .initialPersona(props.getDefaultPersona())
                .pluginRegistry(pluginRegistry)
                .stylist(personaStylist)
                .reminderService(reminderService)
                .timeUtility(timeUtility)
                .robotOutput(connectionManager)
                .turnTracker(turnTracker)
                .metrics(metrics)
                .stylingEnabled(props.isStylingEnabled())
                .touchResponse(props.getTouchResponse())
                .build();
    }

    @Bean
    public ActionPlanner actionPlanner(DialogueOrchestrator dialogueOrchestrator,
                                       TimeUtility timeUtility,
                                       ReasoningGateway reasoningGateway,
                                       ConnectionManager connectionManager,
                                       InteractionLog interactionLog,
                                       DialogueMetrics metrics,
                                       HardwareProperties hardwareProperties) {
        ActionPlanner planner = new ActionPlanner(dialogueOrchestrator, timeUtility, reasoningGateway,
                connectionManager, interactionLog, metrics, hardwareProperties.getMotionSpeed());
        dialogueOrchestrator.bindSpeechProcessor(planner);
        return planner;
    }

    /**
     * Depends on the planner bean so a speech processor is bound before sensor events arrive.
     */
    @Bean
    @DependsOn("actionPlanner")
    public GenesisRuntime genesisRuntime(ConnectionManager connectionManager,
                                         ConnectionHeartbeat connectionHeartbeat,
                                         DialogueOrchestrator dialogueOrchestrator,
                                         PluginRegistry pluginRegistry,
                                         TurnTracker turnTracker,
                                         HardwareProperties hardwareProperties,
                                         DialogueProperties dialogueProperties) {
        return new GenesisRuntime(connectionManager, connectionHeartbeat, dialogueOrchestrator, pluginRegistry,
                turnTracker, hardwareProperties, dialogueProperties);
    }
}

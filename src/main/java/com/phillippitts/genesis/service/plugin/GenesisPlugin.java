package com.phillippitts.genesis.service.plugin;

import com.phillippitts.genesis.domain.IntentResult;

import java.util.concurrent.CompletableFuture;

/**
 * Extension that answers intents the dialogue orchestrator has no built-in handler for.
 *
 * <p>{@link #execute} runs on the dialogue executor and may block briefly. Exceptions it throws
 * are caught by the orchestrator and turned into an apology naming the intent.
 */
public interface GenesisPlugin {

    String name();

    String description();

    boolean supportsIntent(String intent);

    /**
     * Produces the reply for one utterance.
     *
     * @param rawText the utterance as heard
     * @param intent the resolved intent and entities
     * @return text to speak
     */
    String execute(String rawText, IntentResult intent);

    /**
     * Optional background work started once at runtime start and cancelled at shutdown.
     *
     * @return future that completes when the background work ends
     */
    default CompletableFuture<Void> run() {
        return CompletableFuture.completedFuture(null);
    }
}

package com.phillippitts.genesis.service.dialogue;

import java.util.concurrent.CompletableFuture;

/**
 * Runs a complete turn for one utterance: decide the reply, speak it and move.
 */
public interface SpeechProcessor {

    /**
     * @return future with the reply that was spoken; never completes exceptionally for
     *         ordinary failures, which are reported as a spoken apology
     */
    CompletableFuture<String> processUserSpeech(String text);
}

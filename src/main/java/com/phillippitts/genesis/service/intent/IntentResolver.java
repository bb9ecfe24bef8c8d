package com.phillippitts.genesis.service.intent;

import com.phillippitts.genesis.domain.IntentResult;

/**
 * Classifies an utterance into an intent with entities.
 *
 * <p>Implementations must be thread-safe and must not throw for ordinary text; anything they
 * cannot classify resolves to {@link Intents#UNKNOWN}.
 */
public interface IntentResolver {

    IntentResult resolve(String text);
}

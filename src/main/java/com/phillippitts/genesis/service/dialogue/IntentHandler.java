package com.phillippitts.genesis.service.dialogue;

import com.phillippitts.genesis.domain.IntentResult;

/**
 * Built-in handler for one intent. Exceptions are caught by the orchestrator.
 */
@FunctionalInterface
interface IntentHandler {

    String handle(IntentResult intent);
}

package com.phillippitts.genesis.service.dialogue;

import com.phillippitts.genesis.domain.Persona;

/**
 * Read-only view of the conversation state for collaborators that must not change it.
 */
public interface ConversationView {

    Persona currentPersona();

    String currentTone();

    /** Persona and tone read together. */
    ConversationState.Snapshot conversationState();
}

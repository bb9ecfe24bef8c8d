/**
 * Conversation state, intent dispatch and turn tracking.
 *
 * <p>{@link com.phillippitts.genesis.service.dialogue.DialogueOrchestrator} owns persona and tone
 * and decides replies; a {@link com.phillippitts.genesis.service.dialogue.SpeechProcessor} turns a
 * reply into speech and motion.
 */
package com.phillippitts.genesis.service.dialogue;

package com.phillippitts.genesis.service.log;

/**
 * Append-only transcript of completed turns. Implementations never throw.
 */
public interface InteractionLog {

    void append(String userText, String reply);
}

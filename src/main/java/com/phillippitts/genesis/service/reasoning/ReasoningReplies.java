package com.phillippitts.genesis.service.reasoning;

import java.util.Set;

/**
 * Fixed replies the reasoning gateway returns instead of failing, and the prompt layout it sends.
 */
public final class ReasoningReplies {

    public static final String DISCONNECTED = "I am currently disconnected from the external AI services.";
    public static final String EMPTY_OR_FILTERED = "The external AI response was empty or filtered.";
    public static final String TECHNICAL_DIFFICULTIES =
            "I am experiencing technical difficulties reaching the external AI brain.";

    private static final Set<String> SENTINELS = Set.of(DISCONNECTED, EMPTY_OR_FILTERED, TECHNICAL_DIFFICULTIES);

    private ReasoningReplies() {
    }

    public static boolean isSentinel(String reply) {
        return reply != null && SENTINELS.contains(reply);
    }

    /**
     * Single-turn prompt: instruction, then the user's words, then an open assistant slot.
     */
    public static String prompt(String systemInstruction, String userQuery) {
        return systemInstruction + "\n\nUser: " + userQuery + "\n\nAssistant:";
    }
}

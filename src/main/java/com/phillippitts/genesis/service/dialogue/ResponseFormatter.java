package com.phillippitts.genesis.service.dialogue;

/**
 * Standard wording for user-facing error replies.
 */
public final class ResponseFormatter {

    static final String ERROR_PREFIX = "Sorry, I encountered an issue: ";

    private ResponseFormatter() {
    }

    public static String errorMessage(String userMessage) {
        return ERROR_PREFIX + userMessage;
    }

    public static String handlerFailure(String intent) {
        return errorMessage("I had trouble processing your request concerning '" + intent + "'.");
    }

    public static String missingTool(String intent) {
        return errorMessage("I understood the intent '" + intent + "', but I lack the specific tool to execute it directly.");
    }
}

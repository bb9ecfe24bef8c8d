package com.phillippitts.genesis.service.reasoning;

import com.phillippitts.genesis.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Rephrases an internally produced reply in the voice of the active persona.
 *
 * <p>Any sentinel, blank answer or failure from the gateway yields the base reply unchanged, so
 * a disconnected backend never reaches the speaker through styling.
 */
public class PersonaStylist {

    private static final Logger LOG = LogManager.getLogger(PersonaStylist.class);

    static final String STYLE_DIRECTIVE = "Rephrase or style this core information according to your persona "
            + "and tone. The final response will be spoken by a physical robot; keep it conversational "
            + "and slightly concise.";

    private final ReasoningGateway gateway;

    public PersonaStylist(ReasoningGateway gateway) {
        this.gateway = gateway;
    }

    /**
     * @param instruction persona and tone instruction
     * @param baseReply reply to restyle; blank replies are returned as is
     * @param originalQuery the user's words, for context (may be null)
     * @return future with the styled reply, or the base reply on any failure
     */
    public CompletableFuture<String> stylize(String instruction, String baseReply, String originalQuery) {
        if (baseReply == null || baseReply.isBlank()) {
            return CompletableFuture.completedFuture(baseReply);
        }
        String prompt = stylingPrompt(instruction, baseReply, originalQuery);
        LOG.debug("Styling reply: {}", LogSanitizer.truncate(baseReply, 100));

        CompletableFuture<String> call;
        try {
            call = gateway.getResponse(instruction, prompt);
        } catch (RuntimeException e) {
            LOG.warn("Styling request failed; using base reply", e);
            return CompletableFuture.completedFuture(baseReply);
        }
        return call.handle((styled, error) -> {
            if (error != null) {
                LOG.warn("Styling failed; using base reply", error);
                return baseReply;
            }
            if (styled == null || styled.isBlank() || ReasoningReplies.isSentinel(styled)) {
                LOG.warn("Styling unavailable ({}); using base reply",
                        LogSanitizer.truncate(styled, LogSanitizer.PREVIEW_CHARS));
                return baseReply;
            }
            LOG.info("Styled reply received (length: {})", styled.length());
            return styled;
        });
    }

    static String stylingPrompt(String instruction, String baseReply, String originalQuery) {
        List<String> parts = new ArrayList<>();
        parts.add(instruction);
        if (originalQuery != null && !originalQuery.isBlank()) {
            parts.add("User's original query: \"" + originalQuery + "\"");
        }
        parts.add("The system has generated the following CORE information to be stylized: \"" + baseReply + "\"");
        parts.add(STYLE_DIRECTIVE);
        return String.join("\n\n", parts);
    }
}

package com.phillippitts.genesis.service.reasoning;

import java.util.concurrent.CompletableFuture;

/**
 * Stateless access to a remote language model.
 *
 * <p>The returned future never completes exceptionally. Soft failures are reported as one of
 * the fixed replies in {@link ReasoningReplies}, which callers can detect with
 * {@link ReasoningReplies#isSentinel(String)}.
 */
public interface ReasoningGateway {

    /**
     * @param systemInstruction persona and style instructions placed before the query
     * @param userQuery the user's words, or a composed styling prompt
     * @return future with the model's trimmed reply or a sentinel
     */
    CompletableFuture<String> getResponse(String systemInstruction, String userQuery);
}

package com.phillippitts.genesis.service.reasoning;

import com.phillippitts.genesis.service.metrics.DialogueMetrics;
import com.phillippitts.genesis.util.LogSanitizer;
import com.phillippitts.genesis.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Reasoning gateway backed by a {@link GenerativeModelClient}. Blocking calls run on the
 * reasoning executor.
 *
 * <p>Without a client (no API key configured) every call answers
 * {@link ReasoningReplies#DISCONNECTED} immediately.
 */
public class GeminiReasoningGateway implements ReasoningGateway {

    private static final Logger LOG = LogManager.getLogger(GeminiReasoningGateway.class);

    private final GenerativeModelClient client;
    private final Executor reasoningExecutor;
    private final DialogueMetrics metrics;

    /**
     * @param client model transport, or {@code null} when the backend is not configured
     */
    public GeminiReasoningGateway(GenerativeModelClient client, Executor reasoningExecutor, DialogueMetrics metrics) {
        this.client = client;
        this.reasoningExecutor = reasoningExecutor;
        this.metrics = metrics;
        if (client == null) {
            LOG.warn("No reasoning API key configured; external AI services are disabled");
        }
    }

    public boolean isConfigured() {
        return client != null;
    }

    @Override
    public CompletableFuture<String> getResponse(String systemInstruction, String userQuery) {
        if (client == null) {
            metrics.recordReasoningCall("disconnected");
            return CompletableFuture.completedFuture(ReasoningReplies.DISCONNECTED);
        }
        String prompt = ReasoningReplies.prompt(systemInstruction, userQuery);
        try {
            return CompletableFuture.supplyAsync(() -> callModel(prompt, userQuery), reasoningExecutor);
        } catch (RejectedExecutionException e) {
            LOG.warn("Reasoning executor saturated; rejecting call");
            metrics.recordReasoningCall("rejected");
            return CompletableFuture.completedFuture(ReasoningReplies.TECHNICAL_DIFFICULTIES);
        }
    }

    private String callModel(String prompt, String userQuery) {
        long start = System.nanoTime();
        try {
            String text = client.generate(prompt);
            if (text == null || text.isBlank()) {
                LOG.warn("External AI returned empty or blocked response for query: {}...",
                        LogSanitizer.truncate(userQuery, LogSanitizer.PREVIEW_CHARS));
                metrics.recordReasoningCall("empty");
                return ReasoningReplies.EMPTY_OR_FILTERED;
            }
            LOG.debug("External AI replied in {}ms ({} chars)", TimeUtils.elapsedMillis(start), text.length());
            metrics.recordReasoningCall("ok");
            return text.trim();
        } catch (RuntimeException e) {
            LOG.error("Error accessing external AI service after {}ms", TimeUtils.elapsedMillis(start), e);
            metrics.recordReasoningCall("error");
            return ReasoningReplies.TECHNICAL_DIFFICULTIES;
        }
    }
}

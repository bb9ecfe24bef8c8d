package com.phillippitts.genesis.presentation.controller;

import com.phillippitts.genesis.service.dialogue.ConversationState;
import com.phillippitts.genesis.service.dialogue.DialogueOrchestrator;
import com.phillippitts.genesis.util.LogSanitizer;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Operator endpoints: inject an utterance as if the robot had heard it, and inspect the active
 * persona and tone.
 */
@RestController
@RequestMapping("/api")
class OperatorController {

    private static final Logger LOG = LogManager.getLogger(OperatorController.class);

    private final DialogueOrchestrator orchestrator;

    OperatorController(DialogueOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Runs a full turn (reply, speech and motion) and returns the spoken reply once it finishes.
     */
    @PostMapping("/utterances")
    CompletableFuture<ResponseEntity<UtteranceResponse>> submit(@Valid @RequestBody UtteranceRequest request) {
        LOG.info("Operator utterance: '{}'", LogSanitizer.truncate(request.text(), LogSanitizer.PREVIEW_CHARS));
        return orchestrator.submitUtterance(request.text().trim())
                .thenApply(reply -> ResponseEntity.ok(new UtteranceResponse(reply)));
    }

    @GetMapping("/conversation")
    ResponseEntity<ConversationResponse> conversation() {
        ConversationState.Snapshot state = orchestrator.conversationState();
        return ResponseEntity.ok(new ConversationResponse(
                state.persona().name(),
                state.tone(),
                state.persona().languageCode(),
                orchestrator.availablePersonas()));
    }

    record UtteranceRequest(@NotBlank @Size(max = 1000) String text) {
    }

    record UtteranceResponse(String reply) {
    }

    record ConversationResponse(String persona, String tone, String language, List<String> availablePersonas) {
    }
}

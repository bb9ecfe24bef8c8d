package com.phillippitts.genesis.presentation.controller;

import com.phillippitts.genesis.domain.ConnectionState;
import com.phillippitts.genesis.service.connection.ConnectionManager;
import com.phillippitts.genesis.service.dialogue.ConversationView;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Quick operator check before injecting utterances: is the brain up, is the robot attached,
 * and which persona will answer.
 */
@RestController
class PingController {

    private static final Logger log = LogManager.getLogger(PingController.class);

    private final ConnectionManager connectionManager;
    private final ConversationView conversation;

    PingController(ConnectionManager connectionManager, ConversationView conversation) {
        this.connectionManager = connectionManager;
        this.conversation = conversation;
    }

    @GetMapping("/ping")
    ResponseEntity<Map<String, Object>> ping() {
        ConnectionState robot = connectionManager.state();
        String persona = conversation.currentPersona().name();
        log.info("Operator ping: robot {} at {}, persona {}", robot, connectionManager.host(), persona);
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "robot", robot.name(),
                "persona", persona,
                "timestamp", Instant.now().toString()
        ));
    }
}

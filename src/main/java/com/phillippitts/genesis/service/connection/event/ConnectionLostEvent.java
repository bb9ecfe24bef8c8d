package com.phillippitts.genesis.service.connection.event;

import java.time.Instant;

/**
 * Published when the hardware link session is found dead.
 */
public record ConnectionLostEvent(String host, Instant at, String reason) {
    public ConnectionLostEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}

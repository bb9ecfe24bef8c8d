package com.phillippitts.genesis.service.connection.event;

import java.time.Instant;

/**
 * Published when a reconnect attempt succeeds.
 */
public record ConnectionRestoredEvent(String host, Instant at) {
    public ConnectionRestoredEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}

package com.phillippitts.genesis.service.events;

import com.phillippitts.genesis.service.connection.event.ConnectionLostEvent;
import com.phillippitts.genesis.service.connection.event.ConnectionRestoredEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing log lines for connection events. Throttled per host so a flapping link does
 * not flood the log.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onConnectionLost(ConnectionLostEvent e) {
        if (shouldLog("connection-lost-" + e.host())) {
            LOG.warn("Connection to robot at {} lost ({}). Speech and motion are disabled until the "
                    + "heartbeat reconnects.", e.host(), e.reason());
        }
    }

    @EventListener
    void onConnectionRestored(ConnectionRestoredEvent e) {
        if (shouldLog("connection-restored-" + e.host())) {
            LOG.info("Connection to robot at {} restored at {}", e.host(), e.at());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}

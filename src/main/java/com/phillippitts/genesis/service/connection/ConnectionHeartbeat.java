package com.phillippitts.genesis.service.connection;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic connection check. When the link is unhealthy it reconnects and, on success, re-arms
 * the sensor event poller with the latest callback. A failed attempt is retried on the next tick.
 *
 * <p>Inactive until {@link #arm()} is called, so it never races the startup connect. A reconnect
 * that completes after {@link #disarm()} releases its session instead of restarting the poller.
 */
public class ConnectionHeartbeat {

    private static final Logger LOG = LogManager.getLogger(ConnectionHeartbeat.class);

    private final ConnectionManager connectionManager;
    private final AtomicBoolean armed = new AtomicBoolean(false);
    private final AtomicBoolean reconnecting = new AtomicBoolean(false);

    public ConnectionHeartbeat(ConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    public void arm() {
        armed.set(true);
    }

    public void disarm() {
        armed.set(false);
    }

    public boolean isArmed() {
        return armed.get();
    }

    @Scheduled(fixedDelayString = "${genesis.hardware.heartbeat-interval-ms:5000}",
            initialDelayString = "${genesis.hardware.heartbeat-interval-ms:5000}")
    public void checkConnection() {
        if (!armed.get()) {
            return;
        }
        if (!reconnecting.compareAndSet(false, true)) {
            LOG.debug("Reconnect already in progress; skipping heartbeat");
            return;
        }
        try {
            if (connectionManager.isHealthy()) {
                reconnecting.set(false);
                return;
            }
            LOG.warn("Hardware link unhealthy ({}); attempting reconnect", connectionManager.state());
            connectionManager.reconnect().whenComplete((connected, error) -> {
                try {
                    if (!armed.get()) {
                        LOG.info("Heartbeat disarmed while reconnecting to {}; releasing the new session",
                                connectionManager.host());
                        connectionManager.disconnect();
                    } else if (error == null && Boolean.TRUE.equals(connected)) {
                        if (connectionManager.resubscribe()) {
                            LOG.info("Reconnected to {}; sensor event poller re-armed", connectionManager.host());
                        }
                    } else {
                        LOG.warn("Reconnect to {} failed; retrying on next heartbeat", connectionManager.host());
                    }
                } finally {
                    reconnecting.set(false);
                }
            });
        } catch (RuntimeException e) {
            reconnecting.set(false);
            LOG.error("Connection heartbeat failed", e);
        }
    }
}

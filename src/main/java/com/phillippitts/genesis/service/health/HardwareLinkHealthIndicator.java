package com.phillippitts.genesis.service.health;

import com.phillippitts.genesis.domain.ConnectionState;
import com.phillippitts.genesis.service.connection.ConnectionManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the robot hardware link.
 *
 * <ul>
 *   <li>UP: connected and the sensor event poller is running</li>
 *   <li>DEGRADED: connected but the poller is not running</li>
 *   <li>DOWN: not connected (the heartbeat will keep retrying)</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class HardwareLinkHealthIndicator implements HealthIndicator {

    private final ConnectionManager connectionManager;

    public HardwareLinkHealthIndicator(ConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public Health health() {
        ConnectionState state = connectionManager.state();
        boolean polling = connectionManager.isPolling();

        Health.Builder builder = new Health.Builder();
        if (state == ConnectionState.CONNECTED && polling) {
            builder.up();
        } else if (state == ConnectionState.CONNECTED) {
            builder.status("DEGRADED");
        } else {
            builder.down();
        }
        return builder
                .withDetail("host", connectionManager.host())
                .withDetail("state", state.name())
                .withDetail("poller", polling ? "running" : "stopped")
                .build();
    }
}

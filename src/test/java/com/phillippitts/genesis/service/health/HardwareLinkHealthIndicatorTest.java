package com.phillippitts.genesis.service.health;

import com.phillippitts.genesis.domain.ConnectionState;
import com.phillippitts.genesis.service.connection.ConnectionManager;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HardwareLinkHealthIndicatorTest {

    private static ConnectionManager manager(ConnectionState state, boolean polling) {
        ConnectionManager manager = mock(ConnectionManager.class);
        when(manager.state()).thenReturn(state);
        when(manager.isPolling()).thenReturn(polling);
        when(manager.host()).thenReturn("pepper.local");
        return manager;
    }

    @Test
    void shouldReportUpWhenConnectedAndPolling() {
        Health health = new HardwareLinkHealthIndicator(manager(ConnectionState.CONNECTED, true)).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("host", "pepper.local");
        assertThat(health.getDetails()).containsEntry("state", "CONNECTED");
        assertThat(health.getDetails()).containsEntry("poller", "running");
    }

    @Test
    void shouldReportDegradedWhenConnectedButNotPolling() {
        Health health = new HardwareLinkHealthIndicator(manager(ConnectionState.CONNECTED, false)).health();

        assertThat(health.getStatus().getCode()).isEqualTo("DEGRADED");
        assertThat(health.getDetails()).containsEntry("poller", "stopped");
    }

    @Test
    void shouldReportDownWhenDisconnectedOrConnecting() {
        assertThat(new HardwareLinkHealthIndicator(manager(ConnectionState.DISCONNECTED, false)).health().getStatus())
                .isEqualTo(Status.DOWN);
        assertThat(new HardwareLinkHealthIndicator(manager(ConnectionState.CONNECTING, false)).health().getStatus())
                .isEqualTo(Status.DOWN);
    }
}

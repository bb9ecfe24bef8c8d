package com.phillippitts.genesis.service.connection;

import com.phillippitts.genesis.domain.ConnectionState;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionStateMachineTest {

    private final ConnectionStateMachine machine = new ConnectionStateMachine();

    @Test
    void shouldStartDisconnected() {
        assertThat(machine.current()).isEqualTo(ConnectionState.DISCONNECTED);
        assertThat(machine.isConnected()).isFalse();
    }

    @Test
    void shouldFollowConnectAndDisconnectCycle() {
        assertThat(machine.beginConnect()).isTrue();
        assertThat(machine.current()).isEqualTo(ConnectionState.CONNECTING);
        assertThat(machine.connected()).isTrue();
        assertThat(machine.isConnected()).isTrue();
        assertThat(machine.disconnected()).isTrue();
        assertThat(machine.current()).isEqualTo(ConnectionState.DISCONNECTED);
    }

    @Test
    void shouldReturnToDisconnectedWhenConnectFails() {
        machine.beginConnect();

        assertThat(machine.connectFailed()).isTrue();
        assertThat(machine.current()).isEqualTo(ConnectionState.DISCONNECTED);
    }

    @Test
    void shouldRefuseIllegalTransitions() {
        assertThat(machine.connected()).isFalse();
        assertThat(machine.disconnected()).isFalse();

        machine.beginConnect();
        assertThat(machine.beginConnect()).isFalse();
        assertThat(machine.disconnected()).isFalse();
        assertThat(machine.current()).isEqualTo(ConnectionState.CONNECTING);
    }
}

package com.phillippitts.genesis.service.connection;

import com.phillippitts.genesis.domain.ConnectionState;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe owner of the {@link ConnectionState}.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * DISCONNECTED → CONNECTING   (beginConnect)
 * CONNECTING   → CONNECTED    (connected)
 * CONNECTING   → DISCONNECTED (connectFailed)
 * CONNECTED    → DISCONNECTED (disconnected)
 * </pre>
 *
 * <p>Any other requested transition is refused and reported through the return value.
 *
 * @since 1.0
 */
public final class ConnectionStateMachine {

    private final Lock lock = new ReentrantLock();
    private ConnectionState state = ConnectionState.DISCONNECTED;

    /**
     * @return {@code true} if the state moved from DISCONNECTED to CONNECTING
     */
    public boolean beginConnect() {
        return transition(ConnectionState.DISCONNECTED, ConnectionState.CONNECTING);
    }

    /**
     * @return {@code true} if the state moved from CONNECTING to CONNECTED
     */
    public boolean connected() {
        return transition(ConnectionState.CONNECTING, ConnectionState.CONNECTED);
    }

    /**
     * @return {@code true} if the state moved from CONNECTING to DISCONNECTED
     */
    public boolean connectFailed() {
        return transition(ConnectionState.CONNECTING, ConnectionState.DISCONNECTED);
    }

    /**
     * @return {@code true} if the state moved from CONNECTED to DISCONNECTED
     */
    public boolean disconnected() {
        return transition(ConnectionState.CONNECTED, ConnectionState.DISCONNECTED);
    }

    public ConnectionState current() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean isConnected() {
        return current() == ConnectionState.CONNECTED;
    }

    private boolean transition(ConnectionState from, ConnectionState to) {
        lock.lock();
        try {
            if (state != from) {
                return false;
            }
            state = to;
            return true;
        } finally {
            lock.unlock();
        }
    }
}

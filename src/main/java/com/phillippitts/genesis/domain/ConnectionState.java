package com.phillippitts.genesis.domain;

/**
 * Lifecycle state of the hardware link session.
 *
 * <pre>
 * DISCONNECTED → CONNECTING   (connect attempt)
 * CONNECTING   → CONNECTED    (session acquired)
 * CONNECTING   → DISCONNECTED (attempt failed)
 * CONNECTED    → DISCONNECTED (health-check failure or explicit disconnect)
 * </pre>
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}

package com.phillippitts.genesis.service.hardware;

import com.phillippitts.genesis.exception.HardwareLinkException;

/**
 * Factory for sessions on the robot's control link.
 *
 * <p>Opening a session performs the blocking handshake. Implementations must be safe to call
 * again after a previous session died.
 */
public interface HardwareLink {

    /**
     * Opens a new session to the robot.
     *
     * @param host robot host name or address
     * @param port control port
     * @return a live session
     * @throws HardwareLinkException if the handshake fails
     */
    HardwareSession open(String host, int port);
}

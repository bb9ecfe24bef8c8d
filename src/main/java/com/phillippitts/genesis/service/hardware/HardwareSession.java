package com.phillippitts.genesis.service.hardware;

import com.phillippitts.genesis.exception.HardwareLinkException;

/**
 * One live connection to the robot. All primitives are blocking and synchronous.
 *
 * <p>Callers are expected to run speech and motion on the hardware executor and memory reads
 * on the poller thread; implementations need not serialize calls across those threads beyond
 * what the underlying link does.
 */
public interface HardwareSession extends AutoCloseable {

    /**
     * Speaks the text and returns when speech has finished.
     *
     * @throws HardwareLinkException if the robot rejects the command or the link drops
     */
    void say(String text);

    /**
     * Moves to a named posture and returns when the motion has finished.
     *
     * @param posture posture name, e.g. {@code Stand}
     * @param speed fraction of maximum speed in [0, 1]
     * @throws HardwareLinkException if the robot rejects the command or the link drops
     */
    void goToPosture(String posture, double speed);

    /**
     * Reads the current value stored under an event key, or {@code null} if none.
     *
     * @throws HardwareLinkException if the read fails
     */
    Object getData(String key);

    /**
     * Cheap liveness check. Must not block on robot I/O for long.
     */
    boolean isAlive();

    @Override
    void close();
}

package com.phillippitts.genesis.service.connection;

import java.util.concurrent.CompletableFuture;

/**
 * Output channels of the robot as seen by the dialogue pipeline.
 *
 * <p>Both methods return immediately; the future completes when the robot has finished the
 * command. While the link is down the commands are logged no-ops that complete normally.
 */
public interface RobotOutput {

    /**
     * Speaks the text. Completes exceptionally if the robot command fails.
     */
    CompletableFuture<Void> speak(String text);

    /**
     * Moves to a named posture. Completes exceptionally if the robot command fails.
     *
     * @param posture posture name
     * @param speed fraction of maximum speed in [0, 1]
     */
    CompletableFuture<Void> moveToPosture(String posture, double speed);
}

/**
 * Abstraction over the robot's blocking control link, plus an in-process simulated robot.
 */
package com.phillippitts.genesis.service.hardware;

/**
 * Cross-thread bridge from the robot's blocking event memory to the dialogue pipeline.
 */
package com.phillippitts.genesis.service.sensor;
